package com.whereq.easel.controller;

import com.whereq.easel.dto.AsyncJobSubmitResponse;
import com.whereq.easel.dto.GenerationRequest;
import com.whereq.easel.dto.JobCancellationResponse;
import com.whereq.easel.dto.JobStatusResponse;
import com.whereq.easel.exception.QuotaExceededException;
import com.whereq.easel.exception.TopicNotFoundException;
import com.whereq.easel.service.JobStatusTracker;
import com.whereq.easel.service.JobSubmissionService;
import com.whereq.easel.topic.TopicConfig;
import com.whereq.easel.topic.TopicRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Controller for generation job submission and management
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Generation", description = "Submit, inspect and cancel generation jobs")
public class GenerationJobController {

    static final String REQUESTER_HEADER = "X-Requester-Id";

    @Autowired
    private JobSubmissionService jobSubmissionService;

    @Autowired
    private JobStatusTracker statusTracker;

    @Autowired
    private TopicRegistry topicRegistry;

    /**
     * Submit a generation job to a topic
     *
     * @param alias       topic alias
     * @param request     generation request
     * @param requesterId requester id, 0 when anonymous
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/topics/{alias}/jobs")
    @Operation(summary = "Submit job", description = "Queue a generation job for the topic")
    public Mono<ResponseEntity<AsyncJobSubmitResponse>> submitJob(
            @PathVariable String alias,
            @Valid @RequestBody GenerationRequest request,
            @RequestHeader(value = REQUESTER_HEADER, required = false, defaultValue = "0") long requesterId) {

        log.info("Received job submission for topic {} from requester {}", alias, requesterId);

        return jobSubmissionService.submitJob(alias, request, requesterId)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(TopicNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(AsyncJobSubmitResponse.error(e.getMessage()))))
            .onErrorResume(QuotaExceededException.class, e -> {
                log.warn("Quota exceeded: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(AsyncJobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(AsyncJobSubmitResponse.error(e.getMessage())));
            })
            .onErrorResume(IllegalStateException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(AsyncJobSubmitResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job submission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(AsyncJobSubmitResponse.error("Internal server error: " + e.getMessage())));
            });
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @return Mono with job status, 404 when unknown or expired
     */
    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Job status", description = "Current status and delivered artifacts of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(@PathVariable long jobId) {
        return statusTracker.getRecord(jobId)
            .map(record -> ResponseEntity.ok(JobStatusResponse.from(record)))
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * Cancel a job that has not started
     *
     * @param jobId job identifier
     * @param admin whether the caller acts as administrator
     * @return Mono with cancellation response
     */
    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Cancel job", description = "Cancel a job that is still waiting")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable long jobId,
            @RequestParam(value = "admin", defaultValue = "false") boolean admin) {

        log.info("Job cancellation request for {} (admin={})", jobId, admin);

        return jobSubmissionService.cancelJob(jobId, admin)
            .map(ResponseEntity::ok)
            .switchIfEmpty(Mono.just(ResponseEntity.notFound().build()))
            .onErrorResume(IllegalStateException.class, e -> {
                log.warn("Invalid state for cancellation: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .status(HttpStatus.CONFLICT)
                    .build());
            })
            .onErrorResume(Exception.class, e -> {
                log.error("Error cancelling job {}", jobId, e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .build());
            });
    }

    @GetMapping("/topics")
    @Operation(summary = "List topics", description = "Topics currently loaded")
    public Mono<List<Map<String, Object>>> listTopics() {
        return Mono.fromSupplier(() -> topicRegistry.all().stream()
            .map(GenerationJobController::describe)
            .collect(Collectors.toList()));
    }

    /**
     * Rescan the topics directory. Topics that fail validation are skipped and logged.
     *
     * @return Mono with the number of topics now loaded
     */
    @PostMapping("/topics/reload")
    @Operation(summary = "Reload topics", description = "Rescan topic configuration without a restart")
    public Mono<Map<String, Object>> reloadTopics() {
        log.info("Topic reload requested");
        return Mono.fromCallable(topicRegistry::reload)
            .subscribeOn(Schedulers.boundedElastic())
            .map(loaded -> {
                log.info("Topic reload finished: {} topics loaded", loaded);
                Map<String, Object> result = new LinkedHashMap<>();
                result.put("loaded", loaded);
                result.put("topics", topicRegistry.all().stream()
                    .map(TopicConfig::getAlias)
                    .collect(Collectors.toList()));
                return result;
            });
    }

    private static Map<String, Object> describe(TopicConfig topic) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("alias", topic.getAlias());
        info.put("title", topic.getTitle());
        if (topic.getDescription() != null) {
            info.put("description", topic.getDescription());
        }
        info.put("defaults", topic.getDefaults());
        return info;
    }
}
