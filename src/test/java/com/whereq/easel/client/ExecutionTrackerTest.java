package com.whereq.easel.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ExecutionTrackerTest {

    private static final long SECOND = Duration.ofSeconds(1).toNanos();

    private final ExecutionTracker tracker = new ExecutionTracker("p1", 0L, 60 * SECOND);

    @Test
    void firstExecutingNodeStartsExecution_nullNodeCompletes() {
        assertEquals(ExecutionTracker.Phase.EXECUTING, tracker.onEvent(ExecutionEvent.executing("p1", "3"), 2 * SECOND));
        assertEquals(ExecutionTracker.Phase.EXECUTING, tracker.onEvent(ExecutionEvent.executing("p1", "4"), 4 * SECOND));
        assertEquals(ExecutionTracker.Phase.COMPLETED, tracker.onEvent(ExecutionEvent.executing("p1", null), 7 * SECOND));

        ExecutionTimings timings = tracker.timings();
        assertEquals(2.0, timings.getQueueSeconds(), 1e-9);
        assertEquals(5.0, timings.getExecSeconds(), 1e-9);
    }

    @Test
    void completionWithoutExecutingNode_countsAllAsQueue() {
        tracker.onEvent(ExecutionEvent.executing("p1", null), 3 * SECOND);

        ExecutionTimings timings = tracker.timings();
        assertEquals(3.0, timings.getQueueSeconds(), 1e-9);
        assertEquals(0.0, timings.getExecSeconds(), 1e-9);
    }

    @Test
    void eventsForOtherPrompts_areIgnored() {
        assertEquals(ExecutionTracker.Phase.WAITING, tracker.onEvent(ExecutionEvent.executing("p2", null), SECOND));
        assertEquals(ExecutionTracker.Phase.WAITING, tracker.onEvent(ExecutionEvent.executionError("p2", "boom"), SECOND));
        assertEquals(ExecutionTracker.Phase.WAITING, tracker.onEvent(ExecutionEvent.other(), SECOND));
    }

    @Test
    void executionError_failsWithEngineMessage() {
        assertEquals(ExecutionTracker.Phase.FAILED, tracker.onEvent(ExecutionEvent.executionError("p1", "OOM"), SECOND));
        assertEquals("OOM", tracker.getErrorMessage());

        // terminal phases are sticky
        assertEquals(ExecutionTracker.Phase.FAILED, tracker.onEvent(ExecutionEvent.executing("p1", null), 2 * SECOND));
        assertThrows(IllegalStateException.class, tracker::timings);
    }

    @Test
    void deadlineCheckedBeforeEvent() {
        assertEquals(ExecutionTracker.Phase.TIMED_OUT, tracker.onEvent(ExecutionEvent.executing("p1", null), 61 * SECOND));
    }

    @Test
    void checkDeadline_withoutEvents() {
        assertEquals(ExecutionTracker.Phase.WAITING, tracker.checkDeadline(60 * SECOND));
        assertEquals(ExecutionTracker.Phase.TIMED_OUT, tracker.checkDeadline(60 * SECOND + 1));
    }
}
