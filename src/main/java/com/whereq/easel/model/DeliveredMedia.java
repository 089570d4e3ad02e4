package com.whereq.easel.model;

import lombok.Value;
import lombok.ToString;

/**
 * An artifact together with its downloaded content
 */
@Value
public class DeliveredMedia {

    MediaArtifact artifact;

    @ToString.Exclude
    byte[] content;
}
