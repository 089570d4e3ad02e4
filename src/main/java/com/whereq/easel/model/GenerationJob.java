package com.whereq.easel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A generation request accepted by the admission controller.
 *
 * {@code placeholderMessageId} is the registry key used for lookup and cancellation.
 * {@code started}, {@code canceled} and {@code canceledByAdmin} are written only by the
 * admission controller, under its lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class GenerationJob {

    private long chatId;

    private Long threadId;

    /**
     * Handle of the caller-visible status message; unique per outstanding job
     */
    @EqualsAndHashCode.Include
    private long placeholderMessageId;

    /**
     * Requester; values {@code <= 0} are anonymous and not subject to backlog limits
     */
    private long requesterId;

    private String topicAlias;

    private String prompt;

    private Map<String, Object> params;

    private InputAsset inputImage;

    private List<InputAsset> inputImages;

    /**
     * Short id carried by every log line about this job
     */
    private String correlationId;

    /**
     * Where status changes and artifacts are posted, if anywhere
     */
    private String callbackUrl;

    private Instant enqueuedAt;

    /**
     * Whether the job was predicted to wait when it was accepted
     */
    private boolean initiallyQueued;

    private volatile boolean canceled;

    private volatile boolean canceledByAdmin;

    private volatile boolean started;
}
