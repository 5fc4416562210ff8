package com.sagarmitra.service.impl.dto;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Entry of the running message list handed to the model during a turn.
 */
public record AgentMessage(Role role,
                           String content,
                           List<ToolCall> toolCalls,
                           @Nullable String toolCallId,
                           @Nullable String toolName) {

    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public AgentMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AgentMessage system(String content) {
        return new AgentMessage(Role.SYSTEM, content, List.of(), null, null);
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(Role.USER, content, List.of(), null, null);
    }

    public static AgentMessage assistant(String content) {
        return new AgentMessage(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static AgentMessage assistant(String content, List<ToolCall> toolCalls) {
        return new AgentMessage(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static AgentMessage toolResult(String toolCallId, String toolName, String content) {
        return new AgentMessage(Role.TOOL, content, List.of(), toolCallId, toolName);
    }

    public boolean hasToolCalls() {
        return role == Role.ASSISTANT && !toolCalls.isEmpty();
    }
}
