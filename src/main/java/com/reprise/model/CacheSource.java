package com.reprise.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a cache result came from.
 */
public enum CacheSource {
    SEMANTIC("semantic"),
    EXACT("exact"),
    NONE("none");

    private final String value;

    CacheSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
