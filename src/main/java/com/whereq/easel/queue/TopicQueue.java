package com.whereq.easel.queue;

import com.whereq.easel.model.GenerationJob;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * FIFO of one topic plus the workers consuming it.
 *
 * Jobs are handed to at most {@code workers} concurrent invocations of the worker function,
 * in arrival order; the rest wait in the buffer. {@link #offer} and {@link #close} must not be
 * called concurrently with each other, callers serialize them.
 */
@Slf4j
public class TopicQueue {

    private final String alias;

    private final int workers;

    private final Sinks.Many<GenerationJob> sink = Sinks.many().unicast().onBackpressureBuffer();

    private final Sinks.Empty<Void> drained = Sinks.empty();

    /**
     * Jobs offered but not yet handed to a worker
     */
    private final AtomicInteger depth = new AtomicInteger();

    private Disposable subscription;

    public TopicQueue(String alias, int workers) {
        this.alias = alias;
        this.workers = Math.max(1, workers);
    }

    /**
     * Start consuming.
     *
     * @param worker processes one job; its errors are logged and do not stop the queue
     */
    public synchronized void start(Function<GenerationJob, Mono<Void>> worker) {
        if (subscription != null) {
            throw new IllegalStateException("Queue " + alias + " already started");
        }
        subscription = sink.asFlux()
            .doOnNext(job -> depth.decrementAndGet())
            .flatMap(job -> Mono.defer(() -> worker.apply(job))
                .onErrorResume(e -> {
                    log.error("Worker for topic {} failed on job corr={}", alias, job.getCorrelationId(), e);
                    return Mono.empty();
                }), workers)
            .doFinally(signal -> {
                log.info("Workers stopped for topic {}", alias);
                drained.tryEmitEmpty();
            })
            .subscribe();
        log.info("Started {} worker(s) for topic {}", workers, alias);
    }

    /**
     * @return false if the queue no longer accepts jobs
     */
    public boolean offer(GenerationJob job) {
        depth.incrementAndGet();
        Sinks.EmitResult result = sink.tryEmitNext(job);
        if (result.isFailure()) {
            depth.decrementAndGet();
            log.warn("Topic {} rejected job corr={}: {}", alias, job.getCorrelationId(), result);
            return false;
        }
        return true;
    }

    public int depth() {
        return Math.max(0, depth.get());
    }

    public String getAlias() {
        return alias;
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Stop accepting jobs; workers finish what they hold and then exit
     */
    public void close() {
        sink.tryEmitComplete();
    }

    /**
     * Completes once every worker has exited
     */
    public Mono<Void> awaitDrained() {
        return drained.asMono();
    }

    /**
     * Stop consuming immediately, abandoning jobs in progress
     */
    public synchronized void dispose() {
        if (subscription != null) {
            subscription.dispose();
        }
        drained.tryEmitEmpty();
    }
}
