package com.whereq.easel.client;

import com.whereq.easel.exception.EngineExecutionException;
import com.whereq.easel.exception.EngineProtocolException;
import com.whereq.easel.exception.GenerationTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;

import java.time.Duration;

/**
 * Feeds an event stream into an {@link ExecutionTracker} until the prompt completes, fails or times out
 */
@Slf4j
@Component
public class ExecutionMonitor {

    private final MonotonicClock clock;

    public ExecutionMonitor(MonotonicClock clock) {
        this.clock = clock;
    }

    /**
     * Await completion of a submitted prompt.
     *
     * A silent stream is bounded by the remaining run time as well, so the timeout holds
     * even when no event arrives.
     *
     * @param promptId    engine execution id
     * @param events      event channel messages, already decoded
     * @param submittedAt clock reading taken when the engine accepted the prompt
     * @param runTimeout  total time allowed from submission to completion
     * @return timings on completion; {@link EngineExecutionException} with the engine's message,
     *     {@link GenerationTimeoutException}, or {@link EngineProtocolException} if the stream ends first
     */
    public Mono<ExecutionTimings> await(String promptId, Flux<ExecutionEvent> events,
                                        long submittedAt, Duration runTimeout) {
        ExecutionTracker tracker = new ExecutionTracker(promptId, submittedAt, runTimeout.toNanos());
        long elapsed = clock.nanoTime() - submittedAt;
        Duration remaining = Duration.ofNanos(Math.max(0L, runTimeout.toNanos() - elapsed));

        return events
            .handle((ExecutionEvent event, SynchronousSink<ExecutionTimings> sink) -> {
                ExecutionTracker.Phase before = tracker.getPhase();
                ExecutionTracker.Phase after = tracker.onEvent(event, clock.nanoTime());
                if (after != before) {
                    log.debug("Prompt {}: {} -> {}", promptId, before, after);
                }
                switch (after) {
                    case COMPLETED -> sink.next(tracker.timings());
                    case FAILED -> sink.error(new EngineExecutionException(tracker.getErrorMessage()));
                    case TIMED_OUT -> sink.error(timeout(promptId, runTimeout));
                    default -> {
                    }
                }
            })
            .next()
            .timeout(remaining, Mono.error(() -> timeout(promptId, runTimeout)))
            .switchIfEmpty(Mono.error(() -> new EngineProtocolException(
                "Event stream closed before prompt " + promptId + " completed")));
    }

    private static GenerationTimeoutException timeout(String promptId, Duration runTimeout) {
        return new GenerationTimeoutException(
            "Prompt " + promptId + " did not complete within " + runTimeout.toSeconds() + "s");
    }
}
