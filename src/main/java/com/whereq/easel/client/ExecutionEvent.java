package com.whereq.easel.client;

import lombok.Value;

/**
 * One message from the engine's event channel, reduced to what execution tracking needs
 */
@Value
public class ExecutionEvent {

    public enum Type {
        /**
         * A node started executing; {@code node == null} means the whole graph finished
         */
        EXECUTING,

        /**
         * The engine reported a failure
         */
        EXECUTION_ERROR,

        /**
         * Progress, status, previews and anything else
         */
        OTHER
    }

    private static final ExecutionEvent OTHER_EVENT = new ExecutionEvent(Type.OTHER, null, null, null);

    Type type;

    String promptId;

    String node;

    String message;

    public static ExecutionEvent executing(String promptId, String node) {
        return new ExecutionEvent(Type.EXECUTING, promptId, node, null);
    }

    public static ExecutionEvent executionError(String promptId, String message) {
        return new ExecutionEvent(Type.EXECUTION_ERROR, promptId, null, message);
    }

    public static ExecutionEvent other() {
        return OTHER_EVENT;
    }

    public boolean isFor(String trackedPromptId) {
        return promptId != null && promptId.equals(trackedPromptId);
    }
}
