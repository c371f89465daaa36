package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate counters of the semantic cache.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Live entries in the durable store.
     */
    private long totalEntries;

    private long totalHits;

    private long totalMisses;

    /**
     * Hits over lookups (0.0-1.0).
     */
    private double hitRate;

    /**
     * Misses over lookups (0.0-1.0).
     */
    private double missRate;

    /**
     * Mean similarity of all hits, exact hits counting as 1.0.
     */
    private double averageSimilarity;

    /**
     * Milliseconds of generation avoided.
     */
    private long totalTimeSaved;

    private double totalCostSaved;

    /**
     * Bytes occupied by persisted entries.
     */
    private long storageUsed;

    /**
     * Capacity plus expiry evictions.
     */
    private long evictionCount;

    private long capacityEvictions;

    private long expiredEvictions;

    private long invalidatedEntries;

    private long admissionRejected;

    private long writeFailures;

    /**
     * Milliseconds callers spent generating responses the cache did not have.
     */
    private long totalComputeTimeOnMisses;

    @Builder.Default
    private List<TopQuery> topQueries = new ArrayList<>();

    /**
     * Most frequently served query.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopQuery {
        private String query;
        private long accessCount;
    }
}
