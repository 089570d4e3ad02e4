package com.whereq.easel.service;

import com.whereq.easel.config.EaselProperties;
import com.whereq.easel.dto.AsyncJobSubmitResponse;
import com.whereq.easel.dto.GenerationRequest;
import com.whereq.easel.dto.InputImagePayload;
import com.whereq.easel.dto.JobCancellationResponse;
import com.whereq.easel.exception.QuotaExceededException;
import com.whereq.easel.exception.TopicNotFoundException;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.InputAsset;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.topic.ParameterMerger;
import com.whereq.easel.topic.TopicConfig;
import com.whereq.easel.topic.TopicRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Service for job submission and cancellation
 */
@Slf4j
@Service
public class JobSubmissionService {

    @Autowired
    private TopicRegistry topicRegistry;

    @Autowired
    private ParameterMerger parameterMerger;

    @Autowired
    private AdmissionController admissionController;

    @Autowired
    private JobStatusTracker statusTracker;

    @Autowired
    private DeliveryChannel deliveryChannel;

    @Autowired
    private JobProcessor jobProcessor;

    @Autowired
    private EaselProperties properties;

    private final AtomicLong jobIds = new AtomicLong(System.currentTimeMillis());

    @PostConstruct
    public void initialize() {
        admissionController.setProcessor(jobProcessor);
    }

    /**
     * Submit a generation job
     *
     * @param alias       topic alias
     * @param request     generation request
     * @param requesterId requester, {@code <= 0} for anonymous
     * @return Mono with the submission response; {@link TopicNotFoundException},
     *     {@link QuotaExceededException}, {@link IllegalArgumentException} for undecodable images,
     *     or {@link IllegalStateException} when the controller is not accepting work
     */
    public Mono<AsyncJobSubmitResponse> submitJob(String alias, GenerationRequest request, long requesterId) {
        return Mono.fromCallable(() -> {
                TopicConfig topic = topicRegistry.find(alias)
                    .orElseThrow(() -> new TopicNotFoundException("Topic not found: " + alias));
                List<InputAsset> images = decodeImages(request.getInputImages());
                Map<String, Object> params = parameterMerger.merge(topic, request.getParams(), imageSize(images));

                int limit = properties.getLimits().getPerUserPending();
                boolean reserved = false;
                if (limit > 0 && requesterId > 0) {
                    if (!admissionController.reserveSlot(requesterId, limit)) {
                        throw new QuotaExceededException("Too many pending jobs for requester " + requesterId
                            + " (limit " + limit + ")");
                    }
                    reserved = true;
                }

                boolean queued = admissionController.willQueue(alias);
                GenerationJob job = GenerationJob.builder()
                    .chatId(request.getChatId())
                    .threadId(request.getThreadId())
                    .placeholderMessageId(jobIds.incrementAndGet())
                    .requesterId(requesterId)
                    .topicAlias(alias)
                    .prompt(request.getPrompt())
                    .params(params)
                    .inputImage(images.isEmpty() ? null : images.get(0))
                    .inputImages(images)
                    .correlationId(UUID.randomUUID().toString().substring(0, 8))
                    .callbackUrl(request.getCallbackUrl())
                    .enqueuedAt(Instant.now())
                    .initiallyQueued(queued)
                    .build();

                JobStatus initial = queued ? JobStatus.QUEUED : JobStatus.RUNNING;
                statusTracker.register(job, initial);

                if (!admissionController.enqueue(alias, job, reserved)) {
                    if (reserved) {
                        admissionController.releaseSlot(requesterId);
                    }
                    statusTracker.updateStatus(job.getPlaceholderMessageId(), JobStatus.FAILED,
                        "Service is not accepting jobs").subscribe();
                    throw new IllegalStateException("Service is not accepting jobs");
                }

                return AsyncJobSubmitResponse.builder()
                    .jobId(job.getPlaceholderMessageId())
                    .correlationId(job.getCorrelationId())
                    .status(initial)
                    .topic(alias)
                    .submittedAt(job.getEnqueuedAt())
                    .build();
            })
            .doOnSuccess(response -> log.info("Job {} corr={} submitted to topic {} by requester {}: {}",
                response.getJobId(), response.getCorrelationId(), alias, requesterId, response.getStatus()))
            .doOnError(e -> log.warn("Job submission to topic {} failed for requester {}: {}",
                alias, requesterId, e.getMessage()));
    }

    /**
     * Cancel a job that has not started
     *
     * @param jobId   job identifier
     * @param byAdmin whether an administrator requested it
     * @return Mono with the cancellation response; empty if the job is unknown,
     *     {@link IllegalStateException} if it already started or was canceled
     */
    public Mono<JobCancellationResponse> cancelJob(long jobId, boolean byAdmin) {
        return Mono.justOrEmpty(admissionController.getJob(jobId))
            .flatMap(job -> {
                if (!admissionController.cancelJob(jobId, byAdmin)) {
                    return Mono.error(new IllegalStateException(
                        "Job " + jobId + " has already started or was canceled"));
                }
                String message = byAdmin ? StatusMessages.CANCELED_BY_ADMIN : StatusMessages.CANCELED;
                return deliveryChannel.updateStatus(job, JobStatus.CANCELLED, message)
                    .thenReturn(JobCancellationResponse.builder()
                        .jobId(jobId)
                        .correlationId(job.getCorrelationId())
                        .topic(job.getTopicAlias())
                        .status(JobStatus.CANCELLED)
                        .byAdmin(byAdmin)
                        .cancelledAt(Instant.now())
                        .message(message)
                        .build());
            })
            .doOnSuccess(response -> {
                if (response != null) {
                    log.info("Job {} cancelled (byAdmin={})", jobId, byAdmin);
                }
            })
            .doOnError(e -> log.warn("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    private static List<InputAsset> decodeImages(List<InputImagePayload> payloads) {
        List<InputAsset> assets = new ArrayList<>();
        if (payloads == null) {
            return assets;
        }
        Base64.Decoder decoder = Base64.getDecoder();
        for (InputImagePayload payload : payloads) {
            try {
                assets.add(InputAsset.builder()
                    .filename(payload.getFilename())
                    .content(decoder.decode(payload.getData()))
                    .build());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Input image " + payload.getFilename() + " is not valid base64", e);
            }
        }
        return assets;
    }

    /**
     * Size of the first image, or null if there is none or it cannot be read
     */
    private static ParameterMerger.ImageSize imageSize(List<InputAsset> images) {
        if (images.isEmpty()) {
            return null;
        }
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(images.get(0).getContent()));
            return image == null ? null : new ParameterMerger.ImageSize(image.getWidth(), image.getHeight());
        } catch (IOException e) {
            log.debug("Cannot read input image size: {}", e.getMessage());
            return null;
        }
    }
}
