package com.whereq.easel.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a produced artifact
 */
public enum MediaKind {
    IMAGE,
    VIDEO,
    AUDIO;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
