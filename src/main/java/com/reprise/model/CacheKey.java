package com.reprise.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Lookup view of a request. Built once per request by the key normalizer and never persisted.
 */
@Value
@Builder
public class CacheKey {

    public static final String DEFAULT_PARTITION = "default";

    String query;

    String model;

    List<String> context;

    RequestType requestType;

    /**
     * Canonical query text, fed to hashing and embedding.
     */
    String normalized;

    /**
     * Model/context scope the key belongs to.
     */
    String partition;

    /**
     * SHA-256 of partition and normalized text.
     */
    String fingerprint;

    public boolean isEmpty() {
        return normalized == null || normalized.isEmpty();
    }
}
