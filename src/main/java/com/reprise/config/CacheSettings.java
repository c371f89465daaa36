package com.reprise.config;

import com.reprise.model.EvictionPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable snapshot of the cache configuration. Components read the current snapshot from
 * {@link CacheSettingsHolder} at the start of every operation.
 */
@Value
@Builder(toBuilder = true)
public class CacheSettings {

    public static final Set<String> DEFAULT_STOP_TOKENS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "is", "are", "was", "were", "be", "been", "being",
            "have", "has", "had", "do", "does", "did", "will", "would", "could",
            "should", "may", "might", "must", "can", "what", "how", "when", "where",
            "why", "who", "which", "that", "this", "these", "those"
    );

    @Builder.Default
    boolean enableSemanticCaching = true;

    @Builder.Default
    boolean enableResponseCaching = true;

    @Builder.Default
    boolean enableQueryNormalization = true;

    @Builder.Default
    boolean cacheByModel = true;

    @Builder.Default
    boolean cacheByContext = false;

    /**
     * Admission gate for caller-supplied quality.
     */
    @Builder.Default
    double minResponseQuality = 0.7;

    /**
     * Minimum stored quality a semantic candidate needs to be served.
     */
    @Builder.Default
    double qualityThreshold = 0.7;

    /**
     * Entries older than this are never served. Zero disables the check.
     */
    @Builder.Default
    Duration maxCacheAge = Duration.ofHours(24);

    @Builder.Default
    double similarityThreshold = 0.85;

    /**
     * Capacity in bytes of persisted entries.
     */
    @Builder.Default
    long maxCacheSize = 64L * 1024 * 1024;

    @Builder.Default
    int maxEntries = 10_000;

    /**
     * Fraction of the limits eviction shrinks the cache to.
     */
    @Builder.Default
    double evictionTarget = 0.9;

    @Builder.Default
    Duration defaultTtl = Duration.ofHours(24);

    @Builder.Default
    EvictionPolicy evictionPolicy = EvictionPolicy.HYBRID;

    @Builder.Default
    HybridWeights hybridWeights = HybridWeights.equal();

    @Builder.Default
    Duration recencyHalfLife = Duration.ofHours(24);

    @Builder.Default
    boolean compressionEnabled = true;

    /**
     * Payloads strictly larger than this many bytes are compressed.
     */
    @Builder.Default
    int compressionThreshold = 1000;

    @Builder.Default
    boolean warmupEnabled = true;

    @Builder.Default
    int topK = 5;

    /**
     * Bound on embedding plus index lookup. A slower lookup is a miss.
     */
    @Builder.Default
    Duration semanticTimeout = Duration.ofMillis(500);

    @Builder.Default
    Duration optimizeInterval = Duration.ofMinutes(5);

    @Builder.Default
    int evictionBatchSize = 100;

    @Builder.Default
    Set<String> stopTokens = DEFAULT_STOP_TOKENS;

    public static CacheSettings defaults() {
        return CacheSettings.builder().build();
    }

    /**
     * Weights of the hybrid eviction score.
     */
    @Value
    public static class HybridWeights {
        double recency;
        double frequency;
        double relevance;

        public static HybridWeights of(double recency, double frequency, double relevance) {
            return new HybridWeights(recency, frequency, relevance);
        }

        public static HybridWeights equal() {
            return new HybridWeights(1.0 / 3, 1.0 / 3, 1.0 / 3);
        }
    }
}
