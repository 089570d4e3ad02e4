package com.whereq.easel.exception;

/**
 * Exception thrown when a requester's pending-job backlog is full
 */
public class QuotaExceededException extends RuntimeException {
    public QuotaExceededException(String message) {
        super(message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
