package com.reprise.model;

import lombok.Builder;
import lombok.Value;

/**
 * Transient lookup result. The entry carries the decompressed response.
 */
@Value
@Builder
public class CacheHit {

    CacheEntry entry;

    /**
     * Similarity in [0, 1]; 1.0 for exact hits.
     */
    double similarity;

    boolean exact;

    long timeSaved;

    double costSaved;
}
