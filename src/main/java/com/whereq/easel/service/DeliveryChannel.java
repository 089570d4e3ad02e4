package com.whereq.easel.service;

import com.whereq.easel.model.DeliveredMedia;
import com.whereq.easel.model.GenerationJob;
import com.whereq.easel.model.JobStatus;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Where the requester sees a job's progress and results
 */
public interface DeliveryChannel {

    /**
     * Replace the job's visible status
     *
     * @param text human-readable status line
     */
    Mono<Void> updateStatus(GenerationJob job, JobStatus status, String text);

    /**
     * Hand over the produced media; the job is done afterwards
     */
    Mono<Void> deliver(GenerationJob job, List<DeliveredMedia> media, String caption);
}
