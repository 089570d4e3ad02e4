package com.whereq.easel.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Input image sent inline with a request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputImagePayload {

    private String filename;

    /**
     * Base64-encoded image bytes
     */
    @NotBlank(message = "Image data is required")
    @ToString.Exclude
    private String data;
}
