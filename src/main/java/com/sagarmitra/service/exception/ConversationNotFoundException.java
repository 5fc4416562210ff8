package com.sagarmitra.service.exception;

public class ConversationNotFoundException extends RuntimeException {

    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
