package com.whereq.easel.service;

import com.whereq.easel.model.DeliveredMedia;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.model.MediaArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service for posting job updates to a requester's callback URL
 */
@Slf4j
@Service
public class WebhookNotifier {

    @Autowired
    private WebClient.Builder webClientBuilder;

    private static final Duration WEBHOOK_TIMEOUT = Duration.ofSeconds(10);

    /**
     * Notify about a status change
     *
     * @param job     the job; nothing is sent when it has no callback URL
     * @param status  job status
     * @param message status text
     * @return Mono that completes when the notification was sent or failed
     */
    public Mono<Void> notifyStatus(GenerationJob job, JobStatus status, String message) {
        Map<String, Object> payload = basePayload(job, status);
        if (message != null) {
            payload.put("message", message);
        }
        return post(job, status, payload);
    }

    /**
     * Post the delivered media, base64 encoded
     */
    public Mono<Void> notifyDelivery(GenerationJob job, List<DeliveredMedia> media, String caption) {
        Map<String, Object> payload = basePayload(job, JobStatus.SUCCEEDED);
        payload.put("caption", caption);

        Base64.Encoder encoder = Base64.getEncoder();
        List<Map<String, Object>> items = new ArrayList<>();
        for (DeliveredMedia item : media) {
            MediaArtifact artifact = item.getArtifact();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("filename", artifact.getFilename());
            entry.put("kind", artifact.getKind());
            entry.put("mimeType", artifact.getMimeType());
            entry.put("data", encoder.encodeToString(item.getContent()));
            items.add(entry);
        }
        payload.put("media", items);
        return post(job, JobStatus.SUCCEEDED, payload);
    }

    private Mono<Void> post(GenerationJob job, JobStatus status, Map<String, Object> payload) {
        String webhookUrl = job.getCallbackUrl();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .toBodilessEntity()
            .timeout(WEBHOOK_TIMEOUT)
            .doOnSuccess(response -> log.info("Webhook notification sent for job corr={}: {} - {}",
                job.getCorrelationId(), status, response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job corr={}: {}",
                job.getCorrelationId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // a failed webhook never fails the job
            .then();
    }

    private Map<String, Object> basePayload(GenerationJob job, JobStatus status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getPlaceholderMessageId());
        payload.put("correlationId", job.getCorrelationId());
        payload.put("topic", job.getTopicAlias());
        payload.put("status", status.name());
        payload.put("timestamp", System.currentTimeMillis());
        return payload;
    }
}
