package com.whereq.easel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Input image supplied with a request, uploaded to the engine before submission
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InputAsset {

    /**
     * Filename hint for the upload
     */
    private String filename;

    @ToString.Exclude
    private byte[] content;
}
