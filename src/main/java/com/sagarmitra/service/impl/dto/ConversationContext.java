package com.sagarmitra.service.impl.dto;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Verbatim trailing window of a conversation plus the rolling summary of everything older.
 */
public record ConversationContext(List<AgentMessage> recentMessages, @Nullable String summary) {

    public ConversationContext {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }
}
