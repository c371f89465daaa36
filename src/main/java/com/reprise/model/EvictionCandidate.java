package com.reprise.model;

import lombok.Builder;
import lombok.Value;

/**
 * Usage statistics of a live entry, read from the store's secondary indices.
 */
@Value
@Builder
public class EvictionCandidate {
    String id;
    long lastAccessedMillis;
    long accessCount;
    double relevance;
    long sizeBytes;
}
