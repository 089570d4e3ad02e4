package com.whereq.easel.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.whereq.easel.model.JobStatus;
import com.whereq.easel.model.MediaArtifact;
import com.whereq.easel.service.JobStatusTracker;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Response for job status query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusResponse {

    private Long jobId;

    private String correlationId;

    private String topic;

    private JobStatus status;

    /**
     * Latest status text; the caption once media was delivered
     */
    private String message;

    private Instant submittedAt;

    private Instant startedAt;

    private Instant completedAt;

    @Builder.Default
    private List<MediaArtifact> artifacts = new ArrayList<>();

    public static JobStatusResponse from(JobStatusTracker.JobRecord record) {
        return JobStatusResponse.builder()
            .jobId(record.getJobId())
            .correlationId(record.getCorrelationId())
            .topic(record.getTopicAlias())
            .status(record.getStatus())
            .message(record.getMessage())
            .submittedAt(record.getSubmittedAt())
            .startedAt(record.getStartedAt())
            .completedAt(record.getCompletedAt())
            .artifacts(new ArrayList<>(record.getArtifacts()))
            .build();
    }
}
