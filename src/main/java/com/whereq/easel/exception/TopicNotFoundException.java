package com.whereq.easel.exception;

/**
 * Exception thrown when a request names a topic that is not loaded
 */
public class TopicNotFoundException extends RuntimeException {
    public TopicNotFoundException(String message) {
        super(message);
    }

    public TopicNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
