package com.whereq.easel.client;

import com.whereq.easel.exception.EngineExecutionException;
import com.whereq.easel.exception.EngineProtocolException;
import com.whereq.easel.exception.GenerationTimeoutException;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class ExecutionMonitorTest {

    private static final Duration RUN_TIMEOUT = Duration.ofSeconds(30);

    private final FakeClock clock = new FakeClock();

    private final ExecutionMonitor monitor = new ExecutionMonitor(clock);

    @Test
    void completion_reportsMeasuredTimings() {
        long submittedAt = clock.nanoTime();
        Flux<ExecutionEvent> events = Flux.just(
                ExecutionEvent.executing("p1", "3"),
                ExecutionEvent.executing("p1", null))
            .index()
            .doOnNext(indexed -> clock.advance(indexed.getT1() == 0 ? Duration.ofSeconds(2) : Duration.ofMillis(3500)))
            .map(indexed -> indexed.getT2());

        StepVerifier.create(monitor.await("p1", events, submittedAt, RUN_TIMEOUT))
            .assertNext(timings -> {
                assertEquals(2.0, timings.getQueueSeconds(), 1e-9);
                assertEquals(3.5, timings.getExecSeconds(), 1e-9);
            })
            .verifyComplete();
    }

    @Test
    void executionError_failsWithVerbatimMessage() {
        Flux<ExecutionEvent> events = Flux.just(
            ExecutionEvent.executing("p1", "3"),
            ExecutionEvent.executionError("p1", "OOM"));

        StepVerifier.create(monitor.await("p1", events, clock.nanoTime(), RUN_TIMEOUT))
            .expectErrorSatisfies(error -> {
                assertInstanceOf(EngineExecutionException.class, error);
                assertEquals("OOM", error.getMessage());
            })
            .verify();
    }

    @Test
    void eventsOfOtherPrompts_doNotCompleteTracking() {
        Flux<ExecutionEvent> events = Flux.just(
            ExecutionEvent.executing("other", null),
            ExecutionEvent.executionError("other", "not ours"),
            ExecutionEvent.other(),
            ExecutionEvent.executing("p1", null));

        StepVerifier.create(monitor.await("p1", events, clock.nanoTime(), RUN_TIMEOUT))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void lateEvent_pastDeadline_timesOut() {
        long submittedAt = clock.nanoTime();
        Flux<ExecutionEvent> events = Flux.just(ExecutionEvent.executing("p1", null))
            .doOnNext(event -> clock.advance(RUN_TIMEOUT.plusSeconds(1)));

        StepVerifier.create(monitor.await("p1", events, submittedAt, RUN_TIMEOUT))
            .expectError(GenerationTimeoutException.class)
            .verify();
    }

    @Test
    void silentStream_timesOut() {
        StepVerifier.create(monitor.await("p1", Flux.never(), clock.nanoTime(), Duration.ofMillis(100)))
            .expectError(GenerationTimeoutException.class)
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void streamClosedEarly_isProtocolError() {
        Flux<ExecutionEvent> events = Flux.just(ExecutionEvent.executing("p1", "3"));

        StepVerifier.create(monitor.await("p1", events, clock.nanoTime(), RUN_TIMEOUT))
            .expectError(EngineProtocolException.class)
            .verify();
    }
}
