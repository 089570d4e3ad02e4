package com.whereq.easel.exception;

/**
 * Exception thrown when no terminal event arrives within the run timeout
 */
public class GenerationTimeoutException extends RuntimeException {
    public GenerationTimeoutException(String message) {
        super(message);
    }

    public GenerationTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
