package com.whereq.easel.service;

import com.whereq.easel.model.DeliveredMedia;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.model.MediaArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Delivery into the status tracker, mirrored to the job's callback URL when it has one
 */
@Slf4j
@Service
public class TrackingDeliveryChannel implements DeliveryChannel {

    @Autowired
    private JobStatusTracker statusTracker;

    @Autowired
    private WebhookNotifier webhookNotifier;

    @Override
    public Mono<Void> updateStatus(GenerationJob job, JobStatus status, String text) {
        return statusTracker.updateStatus(job.getPlaceholderMessageId(), status, text)
            .then(webhookNotifier.notifyStatus(job, status, text));
    }

    @Override
    public Mono<Void> deliver(GenerationJob job, List<DeliveredMedia> media, String caption) {
        List<MediaArtifact> artifacts = media.stream()
            .map(DeliveredMedia::getArtifact)
            .collect(Collectors.toList());
        log.info("Delivering {} artifact(s) for job corr={}", artifacts.size(), job.getCorrelationId());
        return statusTracker.complete(job.getPlaceholderMessageId(), artifacts, caption)
            .then(webhookNotifier.notifyDelivery(job, media, caption));
    }
}
