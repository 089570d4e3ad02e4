package com.whereq.easel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.easel.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of canceling a job that had not started yet
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobCancellationResponse {

    private Long jobId;

    private String correlationId;

    private String topic;

    /**
     * Always CANCELLED; a job that already started cannot be canceled
     */
    private JobStatus status;

    /**
     * Whether an administrator canceled it rather than the requester
     */
    private boolean byAdmin;

    private Instant cancelledAt;

    /**
     * Status text shown to the requester
     */
    private String message;
}
