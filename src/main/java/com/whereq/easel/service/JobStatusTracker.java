package com.whereq.easel.service;

import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.model.MediaArtifact;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Track job status and delivered artifacts in memory.
 *
 * Records of finished jobs are kept for {@code easel.jobs.retention}, then evicted.
 */
@Slf4j
@Service
public class JobStatusTracker {

    private final Map<Long, JobRecord> records = new ConcurrentHashMap<>();

    private final Duration retention;

    private final Clock clock;

    @Autowired
    public JobStatusTracker(EaselProperties properties) {
        this(properties.getJobs().getRetention(), Clock.systemUTC());
    }

    JobStatusTracker(Duration retention, Clock clock) {
        this.retention = retention;
        this.clock = clock;
    }

    /**
     * Create the record of a newly accepted job
     */
    public JobRecord register(GenerationJob job, JobStatus initialStatus) {
        JobRecord record = new JobRecord();
        record.setJobId(job.getPlaceholderMessageId());
        record.setCorrelationId(job.getCorrelationId());
        record.setTopicAlias(job.getTopicAlias());
        record.setRequesterId(job.getRequesterId());
        record.setPrompt(job.getPrompt());
        record.setStatus(initialStatus);
        record.setSubmittedAt(job.getEnqueuedAt() != null ? job.getEnqueuedAt() : clock.instant());
        records.put(record.getJobId(), record);
        log.debug("Tracking job {} corr={}: {}", record.getJobId(), record.getCorrelationId(), initialStatus);
        return record;
    }

    /**
     * Update job status.
     *
     * A record in a terminal state is not changed again.
     *
     * @param jobId   job identifier
     * @param status  new status
     * @param message text shown to the requester, may be null
     * @return Mono that completes when updated
     */
    public Mono<Void> updateStatus(long jobId, JobStatus status, String message) {
        return Mono.fromRunnable(() -> records.computeIfPresent(jobId, (id, record) -> {
            if (record.getStatus() != null && record.getStatus().isTerminal()) {
                log.debug("Job {} already {}, ignoring {}", jobId, record.getStatus(), status);
                return record;
            }
            JobStatus previous = record.getStatus();
            Instant now = clock.instant();
            record.setStatus(status);
            record.setMessage(message);
            if (status == JobStatus.RUNNING && record.getStartedAt() == null) {
                record.setStartedAt(now);
            }
            if (status.isTerminal()) {
                record.setCompletedAt(now);
            }
            log.info("Job {} corr={} status updated: {} -> {}", jobId, record.getCorrelationId(), previous, status);
            return record;
        }));
    }

    /**
     * Mark a job succeeded with the artifacts delivered for it
     */
    public Mono<Void> complete(long jobId, List<MediaArtifact> artifacts, String caption) {
        return updateStatus(jobId, JobStatus.SUCCEEDED, caption)
            .then(Mono.fromRunnable(() -> records.computeIfPresent(jobId, (id, record) -> {
                record.setArtifacts(new ArrayList<>(artifacts));
                return record;
            })));
    }

    /**
     * @return the record, or empty if unknown or evicted
     */
    public Mono<JobRecord> getRecord(long jobId) {
        return Mono.justOrEmpty(records.get(jobId));
    }

    /**
     * Drop finished records older than the retention period
     *
     * @return number of records removed
     */
    @Scheduled(fixedDelayString = "${easel.jobs.eviction-interval:60000}")
    public int evictExpired() {
        Instant cutoff = clock.instant().minus(retention);
        int before = records.size();
        records.values().removeIf(record -> record.getStatus().isTerminal()
            && record.getCompletedAt() != null
            && record.getCompletedAt().isBefore(cutoff));
        int removed = before - records.size();
        if (removed > 0) {
            log.info("Evicted {} finished job record(s)", removed);
        }
        return removed;
    }

    public int size() {
        return records.size();
    }

    @Data
    public static class JobRecord {
        private long jobId;
        private String correlationId;
        private String topicAlias;
        private long requesterId;
        private String prompt;
        private JobStatus status;
        private String message;
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private List<MediaArtifact> artifacts = new ArrayList<>();
    }
}
