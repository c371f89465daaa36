package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * One cached (query, response) pair as persisted in the durable store.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    private String id;

    /**
     * Fingerprint of the normalized, partition-qualified query. Exact lookup key.
     */
    private String queryHash;

    private String query;

    private String normalizedQuery;

    private String partition;

    /**
     * Null when the embedding provider was unavailable at write time (exact-only entry).
     */
    private float[] queryEmbedding;

    private byte[] response;

    /**
     * Whether {@link #response} holds GZIP-compressed bytes.
     */
    private boolean compressed;

    private EntryMetadata metadata;

    private Instant createdAt;

    private Instant lastAccessed;

    private long accessCount;

    /**
     * Rolling average similarity of the hits this entry satisfied. 0 until the first hit.
     */
    private double relevance;

    private int relevanceSamples;

    /**
     * Time to live in seconds. Zero or negative means the entry never expires.
     */
    private long ttlSeconds;

    /**
     * Instant after which the entry is dead, empty for entries that never expire.
     */
    public Optional<Instant> expiryInstant() {
        if (ttlSeconds <= 0 || createdAt == null) {
            return Optional.empty();
        }
        return Optional.of(createdAt.plusSeconds(ttlSeconds));
    }

    public boolean isExpiredAt(Instant now) {
        return expiryInstant().map(now::isAfter).orElse(false);
    }

    public double quality() {
        if (metadata == null || metadata.getQuality() == null) {
            return 0.0;
        }
        return metadata.getQuality();
    }
}
