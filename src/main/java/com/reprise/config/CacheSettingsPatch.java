package com.reprise.config;

import com.reprise.model.EvictionPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.Set;

/**
 * Partial configuration update. Null fields keep their current value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSettingsPatch {

    private Boolean enableSemanticCaching;
    private Boolean enableResponseCaching;
    private Boolean enableQueryNormalization;
    private Boolean cacheByModel;
    private Boolean cacheByContext;
    private Double minResponseQuality;
    private Double qualityThreshold;
    private Duration maxCacheAge;
    private Double similarityThreshold;
    private Long maxCacheSize;
    private Integer maxEntries;
    private Double evictionTarget;
    private Duration defaultTtl;
    private EvictionPolicy evictionPolicy;
    private CacheSettings.HybridWeights hybridWeights;
    private Duration recencyHalfLife;
    private Boolean compressionEnabled;
    private Integer compressionThreshold;
    private Boolean warmupEnabled;
    private Integer topK;
    private Duration semanticTimeout;
    private Duration optimizeInterval;
    private Integer evictionBatchSize;
    private Set<String> stopTokens;

    /**
     * Merge this patch over {@code base}.
     */
    public CacheSettings applyTo(CacheSettings base) {
        CacheSettings.CacheSettingsBuilder builder = base.toBuilder();

        if (enableSemanticCaching != null) builder.enableSemanticCaching(enableSemanticCaching);
        if (enableResponseCaching != null) builder.enableResponseCaching(enableResponseCaching);
        if (enableQueryNormalization != null) builder.enableQueryNormalization(enableQueryNormalization);
        if (cacheByModel != null) builder.cacheByModel(cacheByModel);
        if (cacheByContext != null) builder.cacheByContext(cacheByContext);
        if (minResponseQuality != null) builder.minResponseQuality(minResponseQuality);
        if (qualityThreshold != null) builder.qualityThreshold(qualityThreshold);
        if (maxCacheAge != null) builder.maxCacheAge(maxCacheAge);
        if (similarityThreshold != null) builder.similarityThreshold(similarityThreshold);
        if (maxCacheSize != null) builder.maxCacheSize(maxCacheSize);
        if (maxEntries != null) builder.maxEntries(maxEntries);
        if (evictionTarget != null) builder.evictionTarget(evictionTarget);
        if (defaultTtl != null) builder.defaultTtl(defaultTtl);
        if (evictionPolicy != null) builder.evictionPolicy(evictionPolicy);
        if (hybridWeights != null) builder.hybridWeights(hybridWeights);
        if (recencyHalfLife != null) builder.recencyHalfLife(recencyHalfLife);
        if (compressionEnabled != null) builder.compressionEnabled(compressionEnabled);
        if (compressionThreshold != null) builder.compressionThreshold(compressionThreshold);
        if (warmupEnabled != null) builder.warmupEnabled(warmupEnabled);
        if (topK != null) builder.topK(topK);
        if (semanticTimeout != null) builder.semanticTimeout(semanticTimeout);
        if (optimizeInterval != null) builder.optimizeInterval(optimizeInterval);
        if (evictionBatchSize != null) builder.evictionBatchSize(evictionBatchSize);
        if (stopTokens != null) builder.stopTokens(Set.copyOf(stopTokens));

        return builder.build();
    }
}
