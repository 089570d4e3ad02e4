package com.whereq.easel.model;

/**
 * Generation job lifecycle states
 *
 * State transitions:
 * QUEUED → RUNNING → {SUCCEEDED, FAILED, TIMEOUT}
 * QUEUED → CANCELLED (only before the job has started)
 */
public enum JobStatus {
    /**
     * Accepted, waiting for a topic worker or a global slot
     */
    QUEUED,

    /**
     * Worker holds a global slot; uploading, rendering or executing
     */
    RUNNING,

    /**
     * Artifacts delivered
     */
    SUCCEEDED,

    /**
     * Terminated with error (engine error, upload failure, no media, unknown topic)
     */
    FAILED,

    /**
     * Canceled before it started
     */
    CANCELLED,

    /**
     * No terminal event within the run timeout
     */
    TIMEOUT;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED || this == TIMEOUT;
    }
}
