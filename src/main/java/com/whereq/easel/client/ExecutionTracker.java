package com.whereq.easel.client;

import lombok.Getter;

/**
 * Execution state of one submitted prompt, driven by events and a monotonic clock.
 *
 * The deadline is checked before each event is applied. Events for other prompt ids
 * and events of type {@link ExecutionEvent.Type#OTHER} do not change the state.
 * Once terminal, the tracker ignores further input.
 */
public class ExecutionTracker {

    public enum Phase {
        WAITING,
        EXECUTING,
        COMPLETED,
        FAILED,
        TIMED_OUT;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == TIMED_OUT;
        }
    }

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    @Getter
    private final String promptId;

    private final long submittedAt;

    private final long timeoutNanos;

    @Getter
    private Phase phase = Phase.WAITING;

    private boolean execStarted;

    private long execStartedAt;

    private long completedAt;

    @Getter
    private String errorMessage;

    /**
     * @param promptId     engine execution id being tracked
     * @param submittedAt  clock reading taken when the engine accepted the prompt
     * @param timeoutNanos run timeout, measured from {@code submittedAt}
     */
    public ExecutionTracker(String promptId, long submittedAt, long timeoutNanos) {
        this.promptId = promptId;
        this.submittedAt = submittedAt;
        this.timeoutNanos = timeoutNanos;
    }

    public Phase onEvent(ExecutionEvent event, long now) {
        if (phase.isTerminal()) {
            return phase;
        }
        if (checkDeadline(now) == Phase.TIMED_OUT) {
            return phase;
        }
        if (!event.isFor(promptId)) {
            return phase;
        }

        switch (event.getType()) {
            case EXECUTING -> {
                if (event.getNode() == null) {
                    completedAt = now;
                    phase = Phase.COMPLETED;
                } else if (!execStarted) {
                    execStarted = true;
                    execStartedAt = now;
                    phase = Phase.EXECUTING;
                }
            }
            case EXECUTION_ERROR -> {
                errorMessage = event.getMessage();
                phase = Phase.FAILED;
            }
            default -> {
            }
        }
        return phase;
    }

    public Phase checkDeadline(long now) {
        if (!phase.isTerminal() && now - submittedAt > timeoutNanos) {
            phase = Phase.TIMED_OUT;
        }
        return phase;
    }

    /**
     * Timing breakdown; when no node was seen executing, the whole wait counts as queue time.
     *
     * @throws IllegalStateException if the prompt has not completed
     */
    public ExecutionTimings timings() {
        if (phase != Phase.COMPLETED) {
            throw new IllegalStateException("Prompt " + promptId + " has not completed (" + phase + ")");
        }
        if (!execStarted) {
            return new ExecutionTimings(seconds(completedAt - submittedAt), 0d);
        }
        return new ExecutionTimings(
            seconds(execStartedAt - submittedAt),
            seconds(completedAt - execStartedAt));
    }

    private static double seconds(long nanos) {
        return Math.max(0L, nanos) / NANOS_PER_SECOND;
    }
}
