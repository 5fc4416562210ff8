package com.sagarmitra.service.impl.dto;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Transient state of one turn as it moves through the pipeline. Created per inbound
 * message and dropped once the turn completes; only its side effects persist.
 */
@Getter
@Setter
@ToString(exclude = "messages")
public class AgentTurnState {

    private final String userId;
    private final String conversationId;
    private final String selectedLanguage;
    private final String humanInput;

    private final List<AgentMessage> messages = new ArrayList<>();
    private final List<ToolOutput> toolOutputs = new ArrayList<>();
    private final List<ToolCallSummary> toolCallsUsed = new ArrayList<>();

    private boolean languageAccepted;
    private String languageRejection;
    private int toolRounds;
    private String finalAnswer;

    public AgentTurnState(String userId, String conversationId, String selectedLanguage, String humanInput) {
        this.userId = userId;
        this.conversationId = conversationId;
        this.selectedLanguage = selectedLanguage;
        this.humanInput = humanInput;
    }

    public AgentMessage lastMessage() {
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }
}
