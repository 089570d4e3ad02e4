package com.whereq.easel.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Request to generate media for a topic
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    @NotBlank(message = "Prompt is required")
    @Size(max = 4000, message = "Prompt must not exceed 4000 characters")
    @Schema(description = "Positive prompt", example = "a lighthouse at dusk, oil painting")
    private String prompt;

    /**
     * Parameter overrides, subject to the topic's allow-list and limits
     */
    @Schema(description = "Parameter overrides", example = "{\"width\": 768, \"steps\": 30}")
    private Map<String, Object> params;

    /**
     * Conversation the result belongs to
     */
    private long chatId;

    private Long threadId;

    @Valid
    @Builder.Default
    private List<InputImagePayload> inputImages = new ArrayList<>();

    /**
     * Receives status changes and the produced media as JSON POSTs
     */
    @Schema(description = "Webhook URL for status changes and results")
    private String callbackUrl;
}
