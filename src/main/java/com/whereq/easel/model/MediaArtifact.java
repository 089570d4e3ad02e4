package com.whereq.easel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A file produced by the engine, retrievable through {@link #getUrl()}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaArtifact {

    private String url;

    private String filename;

    private String subfolder;

    private MediaKind kind;

    @Builder.Default
    private String mimeType = "application/octet-stream";
}
