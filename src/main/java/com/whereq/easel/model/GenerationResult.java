package com.whereq.easel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of one tracked engine execution
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationResult {
    /**
     * Produced artifacts, videos first, then images, then audio
     */
    @Builder.Default
    private List<MediaArtifact> artifacts = new ArrayList<>();

    /**
     * Time between submission and the first executing node, in seconds
     */
    private double queueDurationSeconds;

    /**
     * Time between the first executing node and graph completion, in seconds
     */
    private double execDurationSeconds;

    /**
     * Engine-side execution id
     */
    private String promptId;
}
