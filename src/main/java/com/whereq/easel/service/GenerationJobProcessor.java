package com.whereq.easel.service;

import com.whereq.easel.client.GenerationClient;
import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.exception.AssetUploadException;
import com.whereq.easel.exception.EngineExecutionException;
import com.whereq.easel.exception.GenerationTimeoutException;
import com.whereq.easel.graph.NodeGraph;
import com.whereq.easel.graph.RuleKind;
import com.whereq.easel.model.DeliveredMedia;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.GenerationResult;
import com.whereq.easel.model.InputAsset;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.template.WorkflowTemplateEngine;
import com.whereq.easel.topic.TopicConfig;
import com.whereq.easel.topic.TopicRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs an admitted job: uploads inputs, renders the topic's workflow, executes it on the
 * engine and delivers the results.
 *
 * Every outcome is reported through the {@link DeliveryChannel}; nothing is signaled back
 * to the admission controller except completion.
 */
@Slf4j
@Service
public class GenerationJobProcessor implements JobProcessor {

    /**
     * Slack on top of the run timeout for the whole submit-and-track call
     */
    private static final Duration TRACKING_GRACE = Duration.ofSeconds(5);

    private final TopicRegistry topicRegistry;
    private final WorkflowTemplateEngine templateEngine;
    private final GenerationClient generationClient;
    private final DeliveryChannel delivery;
    private final Duration runTimeout;
    private final int maxInputImages;
    private final MeterRegistry meterRegistry;

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Counter timeoutCounter;
    private final Timer executionTimer;

    public GenerationJobProcessor(TopicRegistry topicRegistry,
                                  WorkflowTemplateEngine templateEngine,
                                  GenerationClient generationClient,
                                  DeliveryChannel delivery,
                                  EaselProperties properties,
                                  MeterRegistry meterRegistry) {
        this.topicRegistry = topicRegistry;
        this.templateEngine = templateEngine;
        this.generationClient = generationClient;
        this.delivery = delivery;
        this.runTimeout = properties.getTimeouts().getRun();
        this.maxInputImages = properties.getJobs().getMaxInputImages();
        this.meterRegistry = meterRegistry;

        successCounter = Counter.builder("easel.jobs.succeeded")
            .description("Number of jobs that delivered media")
            .register(meterRegistry);

        failureCounter = Counter.builder("easel.jobs.failed")
            .description("Number of failed jobs")
            .register(meterRegistry);

        timeoutCounter = Counter.builder("easel.jobs.timeout")
            .description("Number of jobs that exceeded the run timeout")
            .register(meterRegistry);

        executionTimer = Timer.builder("easel.jobs.execution.time")
            .description("Time from submission to the engine until delivery")
            .register(meterRegistry);
    }

    @Override
    public Mono<Void> process(GenerationJob job) {
        if (job.isCanceled()) {
            log.info("Job corr={} canceled before processing, skipping", job.getCorrelationId());
            return Mono.empty();
        }

        log.info("Processing job corr={} topic={} requester={}",
            job.getCorrelationId(), job.getTopicAlias(), job.getRequesterId());

        Optional<TopicConfig> found = topicRegistry.find(job.getTopicAlias());
        if (found.isEmpty()) {
            failureCounter.increment();
            return report(job, JobStatus.FAILED, StatusMessages.TOPIC_NOT_FOUND);
        }
        TopicConfig topic = found.get();

        boolean needsImages = topic.hasRule(RuleKind.INPUT_IMAGES);
        boolean needsImage = topic.hasRule(RuleKind.INPUT_IMAGE);
        if ((needsImages && images(job).isEmpty()) || (needsImage && job.getInputImage() == null)) {
            failureCounter.increment();
            return report(job, JobStatus.FAILED, StatusMessages.REQUIRES_INPUT_IMAGE);
        }

        Map<String, Object> params = new LinkedHashMap<>();
        if (job.getParams() != null) {
            params.putAll(job.getParams());
        }

        return uploadInputs(job, needsImages, needsImage, params)
            .thenReturn(true)
            .onErrorResume(AssetUploadException.class, e -> {
                log.error("Upload failed for job corr={}: {}", job.getCorrelationId(), e.getMessage(), e);
                failureCounter.increment();
                return report(job, JobStatus.FAILED, StatusMessages.UPLOAD_FAILED).thenReturn(false);
            })
            .flatMap(uploaded -> {
                if (!uploaded) {
                    return Mono.empty();
                }
                if (job.isCanceled()) {
                    log.info("Job corr={} canceled during upload, stopping", job.getCorrelationId());
                    return Mono.empty();
                }
                return execute(job, topic, params);
            });
    }

    private Mono<Void> uploadInputs(GenerationJob job, boolean needsImages, boolean needsImage,
                                    Map<String, Object> params) {
        Mono<Void> multiple = Mono.empty();
        if (needsImages) {
            List<InputAsset> images = images(job);
            List<InputAsset> accepted = images.subList(0, Math.min(images.size(), maxInputImages));
            if (accepted.size() < images.size()) {
                log.info("Job corr={}: using {} of {} input images", job.getCorrelationId(), accepted.size(), images.size());
            }
            // one at a time, the engine handles concurrent uploads poorly
            multiple = Flux.fromIterable(accepted)
                .concatMap(asset -> generationClient.uploadInputAsset(asset.getContent(), uploadName(job, asset)))
                .collectList()
                .doOnNext(names -> params.put(WorkflowTemplateEngine.INPUT_IMAGES, names))
                .then();
        }

        Mono<Void> single = Mono.empty();
        if (needsImage) {
            InputAsset image = job.getInputImage();
            single = generationClient.uploadInputAsset(image.getContent(), uploadName(job, image))
                .doOnNext(name -> params.put(WorkflowTemplateEngine.INPUT_IMAGE, name))
                .then();
        }
        return multiple.then(single);
    }

    private Mono<Void> execute(GenerationJob job, TopicConfig topic, Map<String, Object> params) {
        Instant enqueuedAt = job.getEnqueuedAt() != null ? job.getEnqueuedAt() : Instant.now();
        double gatewayQueueSeconds = Math.max(0.0, Duration.between(enqueuedAt, Instant.now()).toMillis() / 1000.0);

        Mono<Void> running = Mono.empty();
        if (job.isInitiallyQueued()) {
            running = delivery.updateStatus(job, JobStatus.RUNNING, StatusMessages.GENERATING)
                .onErrorResume(e -> {
                    log.debug("Could not switch job corr={} to running: {}", job.getCorrelationId(), e.getMessage());
                    return Mono.empty();
                });
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        return running
            .then(Mono.defer(() -> {
                NodeGraph graph = templateEngine.render(topic.getWorkflow(), topic.getRules(), job.getPrompt(), params);
                log.info("Submitting job corr={} nodes={} queueWait={}s", job.getCorrelationId(), graph.size(),
                    String.format("%.2f", gatewayQueueSeconds));
                return generationClient.submitAndTrack(graph, runTimeout)
                    .timeout(runTimeout.plus(TRACKING_GRACE));
            }))
            .flatMap(result -> deliverResult(job, result, gatewayQueueSeconds))
            .doFinally(signal -> sample.stop(executionTimer))
            .onErrorResume(e -> handleFailure(job, e));
    }

    private Mono<Void> deliverResult(GenerationJob job, GenerationResult result, double gatewayQueueSeconds) {
        if (result.getArtifacts().isEmpty()) {
            log.warn("Job corr={} produced no media (prompt {})", job.getCorrelationId(), result.getPromptId());
            failureCounter.increment();
            return report(job, JobStatus.FAILED, StatusMessages.NO_MEDIA);
        }

        String caption = StatusMessages.caption(job.getPrompt(), gatewayQueueSeconds,
            result.getQueueDurationSeconds(), result.getExecDurationSeconds());

        return Flux.fromIterable(result.getArtifacts())
            .concatMap(artifact -> generationClient.fetchArtifactBytes(artifact.getUrl())
                .map(bytes -> new DeliveredMedia(artifact, bytes)))
            .collectList()
            .flatMap(media -> delivery.deliver(job, media, caption))
            .doOnSuccess(v -> {
                successCounter.increment();
                log.info("Job done corr={}, media={}, gatewayQueue={}s, engineQueue={}s, exec={}s",
                    job.getCorrelationId(), result.getArtifacts().size(),
                    String.format("%.2f", gatewayQueueSeconds),
                    String.format("%.2f", result.getQueueDurationSeconds()),
                    String.format("%.2f", result.getExecDurationSeconds()));
            });
    }

    private Mono<Void> handleFailure(GenerationJob job, Throwable error) {
        if (error instanceof EngineExecutionException) {
            log.warn("Engine reported an error for job corr={}: {}", job.getCorrelationId(), error.getMessage());
            failureCounter.increment();
            return report(job, JobStatus.FAILED, StatusMessages.engineError(error.getMessage()));
        }
        if (error instanceof GenerationTimeoutException || error instanceof TimeoutException) {
            log.warn("Job corr={} timed out: {}", job.getCorrelationId(), error.getMessage());
            timeoutCounter.increment();
            return report(job, JobStatus.TIMEOUT, StatusMessages.GENERATION_TIMEOUT);
        }
        log.error("Generation failed for job corr={}", job.getCorrelationId(), error);
        failureCounter.increment();
        return report(job, JobStatus.FAILED, StatusMessages.GENERATION_FAILED);
    }

    private Mono<Void> report(GenerationJob job, JobStatus status, String text) {
        return delivery.updateStatus(job, status, text)
            .onErrorResume(e -> {
                log.warn("Could not report {} for job corr={}: {}", status, job.getCorrelationId(), e.getMessage());
                return Mono.empty();
            });
    }

    private static List<InputAsset> images(GenerationJob job) {
        return job.getInputImages() == null ? List.of() : job.getInputImages();
    }

    private static String uploadName(GenerationJob job, InputAsset asset) {
        String filename = asset.getFilename();
        if (filename != null && !filename.isBlank()) {
            return filename;
        }
        return "upload_" + job.getCorrelationId() + ".png";
    }
}
