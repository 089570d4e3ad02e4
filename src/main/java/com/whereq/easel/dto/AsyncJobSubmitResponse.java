package com.whereq.easel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.easel.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for async job submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AsyncJobSubmitResponse {
    /**
     * Job identifier, used for status queries and cancellation
     */
    private Long jobId;

    /**
     * Short id that appears in the service logs for this job
     */
    private String correlationId;

    /**
     * QUEUED when the job is expected to wait, RUNNING when it should start at once
     */
    private JobStatus status;

    private String topic;

    private Instant submittedAt;

    /**
     * Error message (if submission failed)
     */
    private String errorMessage;

    /**
     * Create error response
     */
    public static AsyncJobSubmitResponse error(String message) {
        return AsyncJobSubmitResponse.builder()
            .status(JobStatus.FAILED)
            .errorMessage(message)
            .submittedAt(Instant.now())
            .build();
    }
}
