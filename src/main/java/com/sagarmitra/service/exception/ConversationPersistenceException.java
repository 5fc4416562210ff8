package com.sagarmitra.service.exception;

/**
 * The conversation store could not be read or written. Never masked: a turn that
 * cannot be durably recorded fails with this exception.
 */
public class ConversationPersistenceException extends RuntimeException {

    public ConversationPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
