package com.sagarmitra.service.exception;

public class ConversationAccessDeniedException extends RuntimeException {

    public ConversationAccessDeniedException(String conversationId, String userId) {
        super("Conversation " + conversationId + " is not owned by user " + userId);
    }
}
