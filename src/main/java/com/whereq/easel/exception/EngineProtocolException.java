package com.whereq.easel.exception;

/**
 * Exception thrown when the engine violates the submit/track protocol: rejected prompt, missing ids, truncated event stream
 */
public class EngineProtocolException extends RuntimeException {
    public EngineProtocolException(String message) {
        super(message);
    }

    public EngineProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
