package com.whereq.easel.exception;

/**
 * Exception thrown when a topic's files are unreadable or its rules do not match its node graph
 */
public class TopicConfigurationException extends RuntimeException {
    public TopicConfigurationException(String message) {
        super(message);
    }

    public TopicConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
