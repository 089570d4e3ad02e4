package com.whereq.easel.service;

import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.queue.TopicQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admission and scheduling of generation jobs.
 *
 * Each topic gets its own FIFO served by {@code easel.limits.per-topic} workers, created on
 * first use. A started job additionally holds one of {@code easel.limits.max-workers} global
 * permits while the processor runs. Requesters are capped at
 * {@code easel.limits.per-user-pending} jobs that are accepted but not yet started.
 *
 * <p>All bookkeeping (registry, pending counters, queues, active counts) is guarded by one
 * lock. Cancellation and job start both check-and-set under it, so a job is either canceled
 * or started, never both.
 */
@Slf4j
@Service
public class AdmissionController {

    private final int maxWorkers;

    private final int perTopicLimit;

    private final Duration shutdownTimeout;

    private final Object lock = new Object();

    private final Map<Long, GenerationJob> registry = new HashMap<>();

    private final PendingCounters pending = new PendingCounters();

    private final Map<String, TopicQueue> queues = new LinkedHashMap<>();

    private final Map<String, Integer> activePerTopic = new HashMap<>();

    private final Semaphore permits;

    private int activeGlobal;

    private volatile JobProcessor processor;

    private volatile boolean closed;

    private final Counter acceptedCounter;
    private final Counter rejectedCounter;
    private final Counter canceledCounter;

    @Autowired
    public AdmissionController(EaselProperties properties, MeterRegistry meterRegistry) {
        this(properties.getLimits().getMaxWorkers(), properties.getLimits().getPerTopic(),
            properties.getShutdownTimeout(), meterRegistry);
    }

    AdmissionController(int maxWorkers, int perTopicLimit, Duration shutdownTimeout, MeterRegistry meterRegistry) {
        this.maxWorkers = Math.max(1, maxWorkers);
        this.perTopicLimit = Math.max(1, perTopicLimit);
        this.shutdownTimeout = shutdownTimeout;
        this.permits = new Semaphore(this.maxWorkers, true);

        acceptedCounter = Counter.builder("easel.admission.accepted")
            .description("Number of jobs accepted into a topic queue")
            .register(meterRegistry);

        rejectedCounter = Counter.builder("easel.admission.rejected")
            .description("Number of jobs refused by the admission controller")
            .register(meterRegistry);

        canceledCounter = Counter.builder("easel.admission.canceled")
            .description("Number of jobs canceled before they started")
            .register(meterRegistry);

        Gauge.builder("easel.jobs.active", this, AdmissionController::activeCount)
            .description("Jobs currently holding a global worker permit")
            .register(meterRegistry);

        Gauge.builder("easel.jobs.pending", this, AdmissionController::pendingTotal)
            .description("Jobs accepted but not yet started")
            .register(meterRegistry);

        log.info("Admission controller ready: maxWorkers={}, perTopic={}", this.maxWorkers, this.perTopicLimit);
    }

    /**
     * Install the job processor. Required before {@link #enqueue} accepts anything.
     */
    public void setProcessor(JobProcessor processor) {
        this.processor = processor;
        log.info("Job processor installed: {}", processor.getClass().getSimpleName());
    }

    /**
     * Read-only backlog check; a limit {@code <= 0} or an anonymous requester always passes
     */
    public boolean canEnqueue(long requesterId, int perRequesterLimit) {
        if (perRequesterLimit <= 0 || requesterId <= 0) {
            return true;
        }
        synchronized (lock) {
            return pending.count(requesterId) < perRequesterLimit;
        }
    }

    /**
     * Check the backlog and take a slot in one step.
     *
     * A successful reservation must be followed by {@code enqueue(alias, job, true)} or by
     * {@link #releaseSlot}.
     */
    public boolean reserveSlot(long requesterId, int perRequesterLimit) {
        synchronized (lock) {
            boolean reserved = pending.tryIncrement(requesterId, perRequesterLimit);
            if (!reserved) {
                rejectedCounter.increment();
                log.info("Backlog full for requester {}: pending={}, limit={}",
                    requesterId, pending.count(requesterId), perRequesterLimit);
            }
            return reserved;
        }
    }

    public void releaseSlot(long requesterId) {
        synchronized (lock) {
            pending.decrement(requesterId);
        }
    }

    /**
     * Accept a job into its topic's queue.
     *
     * @param reserved whether the requester's pending slot was already taken by {@link #reserveSlot}
     * @return false when shut down or no processor is installed; nothing is recorded then
     */
    public boolean enqueue(String alias, GenerationJob job, boolean reserved) {
        synchronized (lock) {
            if (closed || processor == null) {
                rejectedCounter.increment();
                log.warn("Refusing job corr={} for topic {}: {}", job.getCorrelationId(), alias,
                    closed ? "shut down" : "no processor installed");
                return false;
            }

            if (job.getEnqueuedAt() == null) {
                job.setEnqueuedAt(Instant.now());
            }
            registry.put(job.getPlaceholderMessageId(), job);
            if (!reserved) {
                pending.increment(job.getRequesterId());
            }

            TopicQueue queue = queues.computeIfAbsent(alias, this::startQueue);
            if (!queue.offer(job)) {
                registry.remove(job.getPlaceholderMessageId());
                if (!reserved) {
                    pending.decrement(job.getRequesterId());
                }
                rejectedCounter.increment();
                return false;
            }

            acceptedCounter.increment();
            log.info("Job accepted corr={} topic={} requester={} queued={} pending={}",
                job.getCorrelationId(), alias, job.getRequesterId(), queue.depth(),
                pending.count(job.getRequesterId()));
            return true;
        }
    }

    /**
     * Whether a job submitted now would probably wait. Only a hint for status labels.
     */
    public boolean willQueue(String alias) {
        synchronized (lock) {
            TopicQueue queue = queues.get(alias);
            int depth = queue == null ? 0 : queue.depth();
            return depth > 0
                || activePerTopic.getOrDefault(alias, 0) >= perTopicLimit
                || activeGlobal >= maxWorkers;
        }
    }

    /**
     * Cancel a job that has not started.
     *
     * @return false if the job is unknown, already started or already canceled
     */
    public boolean cancelJob(long placeholderMessageId, boolean byAdmin) {
        synchronized (lock) {
            GenerationJob job = registry.get(placeholderMessageId);
            if (job == null || job.isStarted() || job.isCanceled()) {
                return false;
            }
            job.setCanceled(true);
            job.setCanceledByAdmin(byAdmin);
            pending.decrement(job.getRequesterId());
            canceledCounter.increment();
            log.info("Job canceled corr={} topic={} byAdmin={}", job.getCorrelationId(), job.getTopicAlias(), byAdmin);
            return true;
        }
    }

    public Optional<GenerationJob> getJob(long placeholderMessageId) {
        synchronized (lock) {
            return Optional.ofNullable(registry.get(placeholderMessageId));
        }
    }

    public int pendingCount(long requesterId) {
        synchronized (lock) {
            return pending.count(requesterId);
        }
    }

    public boolean isAccepting() {
        return !closed && processor != null;
    }

    public Stats stats() {
        synchronized (lock) {
            Map<String, Integer> queued = new LinkedHashMap<>();
            queues.forEach((alias, queue) -> queued.put(alias, queue.depth()));
            return new Stats(activeGlobal, pending.total(), queued);
        }
    }

    /**
     * Stop accepting work, let workers exit, then drop all state.
     *
     * Jobs still waiting in a queue are not started. Jobs already running are given up to
     * {@code easel.shutdown-timeout} to finish.
     */
    @PreDestroy
    public void shutdown() {
        List<TopicQueue> toDrain;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toDrain = new ArrayList<>(queues.values());
            toDrain.forEach(TopicQueue::close);
        }
        log.info("Admission controller shutting down: topics={}", toDrain.size());

        List<Mono<Void>> drains = new ArrayList<>();
        toDrain.forEach(queue -> drains.add(queue.awaitDrained()));
        try {
            Mono.when(drains).block(shutdownTimeout);
        } catch (IllegalStateException e) {
            log.warn("Workers still busy after {}, abandoning them", shutdownTimeout);
            toDrain.forEach(TopicQueue::dispose);
        }

        synchronized (lock) {
            registry.clear();
            pending.clear();
            queues.clear();
            activePerTopic.clear();
        }
        log.info("Admission controller stopped");
    }

    private TopicQueue startQueue(String alias) {
        TopicQueue queue = new TopicQueue(alias, perTopicLimit);
        queue.start(job -> runJob(alias, job));
        return queue;
    }

    private Mono<Void> runJob(String alias, GenerationJob job) {
        synchronized (lock) {
            if (job.isCanceled() || closed) {
                registry.remove(job.getPlaceholderMessageId(), job);
                log.info("Skipping job corr={} topic={}: {}", job.getCorrelationId(), alias,
                    job.isCanceled() ? "canceled" : "shutting down");
                return Mono.empty();
            }
            activePerTopic.merge(alias, 1, Integer::sum);
        }

        AtomicBoolean holdsPermit = new AtomicBoolean();
        AtomicBoolean finished = new AtomicBoolean();
        return Mono.fromCallable(() -> acquirePermit(holdsPermit))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(acquired -> markStarted(alias, job) ? invokeProcessor(job) : Mono.<Void>empty())
            // before the completion reaches the queue, so the next job sees the freed permit
            .doOnTerminate(() -> finish(alias, job, holdsPermit, finished))
            .doOnCancel(() -> finish(alias, job, holdsPermit, finished));
    }

    Boolean acquirePermit(AtomicBoolean holdsPermit) throws InterruptedException {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
        holdsPermit.set(true);
        return Boolean.TRUE;
    }

    /**
     * Transition to started unless canceled while waiting for the permit
     */
    private boolean markStarted(String alias, GenerationJob job) {
        synchronized (lock) {
            if (job.isCanceled() || closed) {
                log.info("Dropping job corr={} topic={} after permit wait: {}", job.getCorrelationId(), alias,
                    job.isCanceled() ? "canceled" : "shutting down");
                return false;
            }
            job.setStarted(true);
            pending.decrement(job.getRequesterId());
            activeGlobal++;
            log.info("Job started corr={} topic={} active={}/{}", job.getCorrelationId(), alias,
                activeGlobal, maxWorkers);
            return true;
        }
    }

    private Mono<Void> invokeProcessor(GenerationJob job) {
        JobProcessor current = processor;
        return Mono.defer(() -> current.process(job))
            .onErrorResume(e -> {
                log.error("Processor failed for job corr={}", job.getCorrelationId(), e);
                return Mono.empty();
            });
    }

    private void finish(String alias, GenerationJob job, AtomicBoolean holdsPermit, AtomicBoolean finished) {
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        synchronized (lock) {
            if (holdsPermit.get()) {
                permits.release();
            }
            if (job.isStarted()) {
                activeGlobal--;
            }
            activePerTopic.computeIfPresent(alias, (key, count) -> count > 1 ? count - 1 : null);
            registry.remove(job.getPlaceholderMessageId(), job);
        }
        log.debug("Job finished corr={} topic={}", job.getCorrelationId(), alias);
    }

    private double activeCount() {
        synchronized (lock) {
            return activeGlobal;
        }
    }

    private double pendingTotal() {
        synchronized (lock) {
            return pending.total();
        }
    }

    /**
     * Point-in-time view of the controller
     */
    @Value
    public static class Stats {
        int active;
        int pending;
        Map<String, Integer> queued;
    }
}
