package com.whereq.easel.controller;

import com.whereq.easel.dto.AsyncJobSubmitResponse;
import com.whereq.easel.dto.GenerationRequest;
import com.whereq.easel.dto.JobCancellationResponse;
import com.whereq.easel.exception.QuotaExceededException;
import com.whereq.easel.exception.TopicNotFoundException;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.service.JobStatusTracker;
import com.whereq.easel.service.JobSubmissionService;
import com.whereq.easel.topic.TopicConfig;
import com.whereq.easel.topic.TopicRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = GenerationJobController.class)
class GenerationJobControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private JobSubmissionService jobSubmissionService;

    @MockBean
    private JobStatusTracker statusTracker;

    @MockBean
    private TopicRegistry topicRegistry;

    private WebTestClient.RequestHeadersSpec<?> submit(String body) {
        return client.post()
            .uri("/api/v1/topics/portrait/jobs")
            .header(GenerationJobController.REQUESTER_HEADER, "7")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body);
    }

    @Test
    void submitJob_accepted() {
        when(jobSubmissionService.submitJob(eq("portrait"), any(GenerationRequest.class), eq(7L)))
            .thenReturn(Mono.just(AsyncJobSubmitResponse.builder()
                .jobId(100L)
                .correlationId("abcd1234")
                .status(JobStatus.QUEUED)
                .topic("portrait")
                .submittedAt(Instant.now())
                .build()));

        submit("{\"prompt\": \"a cat\"}")
            .exchange()
            .expectStatus().isAccepted()
            .expectHeader().location("/api/v1/jobs/100")
            .expectBody()
            .jsonPath("$.jobId").isEqualTo(100)
            .jsonPath("$.status").isEqualTo("QUEUED");
    }

    @Test
    void submitJob_errorsMapToStatusCodes() {
        when(jobSubmissionService.submitJob(eq("portrait"), any(GenerationRequest.class), eq(7L)))
            .thenReturn(Mono.error(new TopicNotFoundException("Topic not found: portrait")))
            .thenReturn(Mono.error(new QuotaExceededException("Too many pending jobs")))
            .thenReturn(Mono.error(new IllegalArgumentException("not valid base64")))
            .thenReturn(Mono.error(new IllegalStateException("Service is not accepting jobs")));

        submit("{\"prompt\": \"a cat\"}").exchange().expectStatus().isNotFound();
        submit("{\"prompt\": \"a cat\"}").exchange().expectStatus().isEqualTo(429)
            .expectBody().jsonPath("$.errorMessage").isEqualTo("Too many pending jobs");
        submit("{\"prompt\": \"a cat\"}").exchange().expectStatus().isBadRequest();
        submit("{\"prompt\": \"a cat\"}").exchange().expectStatus().isEqualTo(503);
    }

    @Test
    void submitJob_blankPrompt_isRejected() {
        submit("{\"prompt\": \"\"}").exchange().expectStatus().isBadRequest();
    }

    @Test
    void getJobStatus_unknownJob_isNotFound() {
        when(statusTracker.getRecord(5L)).thenReturn(Mono.empty());

        client.get().uri("/api/v1/jobs/5").exchange().expectStatus().isNotFound();
    }

    @Test
    void getJobStatus_returnsRecord() {
        JobStatusTracker.JobRecord record = new JobStatusTracker.JobRecord();
        record.setJobId(5L);
        record.setTopicAlias("portrait");
        record.setStatus(JobStatus.FAILED);
        record.setMessage("Engine error: OOM");
        when(statusTracker.getRecord(5L)).thenReturn(Mono.just(record));

        client.get().uri("/api/v1/jobs/5")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.status").isEqualTo("FAILED")
            .jsonPath("$.message").isEqualTo("Engine error: OOM");
    }

    @Test
    void cancelJob_mapsOutcomes() {
        when(jobSubmissionService.cancelJob(1L, true)).thenReturn(Mono.just(JobCancellationResponse.builder()
            .jobId(1L)
            .status(JobStatus.CANCELLED)
            .byAdmin(true)
            .build()));
        when(jobSubmissionService.cancelJob(2L, false)).thenReturn(Mono.empty());
        when(jobSubmissionService.cancelJob(3L, false))
            .thenReturn(Mono.error(new IllegalStateException("already started")));

        client.delete().uri("/api/v1/jobs/1?admin=true").exchange().expectStatus().isOk()
            .expectBody().jsonPath("$.byAdmin").isEqualTo(true);
        client.delete().uri("/api/v1/jobs/2").exchange().expectStatus().isNotFound();
        client.delete().uri("/api/v1/jobs/3").exchange().expectStatus().isEqualTo(409);
    }

    @Test
    void listTopics_describesLoadedTopics() {
        when(topicRegistry.all()).thenReturn(List.of(TopicConfig.builder()
            .alias("portrait")
            .title("Portrait")
            .defaults(Map.of("steps", 30))
            .build()));

        client.get().uri("/api/v1/topics")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].alias").isEqualTo("portrait")
            .jsonPath("$[0].defaults.steps").isEqualTo(30);
    }

    @Test
    void reloadTopics_rescansRegistry() {
        when(topicRegistry.reload()).thenReturn(2);
        when(topicRegistry.all()).thenReturn(List.of(
            TopicConfig.builder().alias("anime").title("Anime").build(),
            TopicConfig.builder().alias("portrait").title("Portrait").build()));

        client.post().uri("/api/v1/topics/reload")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.loaded").isEqualTo(2)
            .jsonPath("$.topics[0]").isEqualTo("anime")
            .jsonPath("$.topics[1]").isEqualTo("portrait");

        verify(topicRegistry).reload();
    }
}
