package com.whereq.easel.exception;

/**
 * Exception carrying an execution failure reported by the engine.
 *
 * The message is the engine's own {@code exception_message}, unchanged.
 */
public class EngineExecutionException extends RuntimeException {
    public EngineExecutionException(String message) {
        super(message);
    }

    public EngineExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
