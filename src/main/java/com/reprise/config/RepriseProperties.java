package com.reprise.config;

import com.reprise.model.EvictionPolicy;
import com.reprise.model.WarmingQuery;
import com.reprise.service.warming.WarmingMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for Reprise.
 */
@Data
@Component
@ConfigurationProperties(prefix = "reprise")
public class RepriseProperties {

    private CacheConfig cache = new CacheConfig();
    private WarmingConfig warming = new WarmingConfig();
    private EmbeddingsConfig embeddings = new EmbeddingsConfig();
    private IndexConfig index = new IndexConfig();
    private StoreConfig store = new StoreConfig();
    private RedisConfig redis = new RedisConfig();

    @Data
    public static class CacheConfig {
        private boolean enableSemanticCaching = true;
        private boolean enableResponseCaching = true;
        private boolean enableQueryNormalization = true;
        private boolean cacheByModel = true;
        private boolean cacheByContext = false;
        private double minResponseQuality = 0.7;
        private double qualityThreshold = 0.7;
        private Duration maxCacheAge = Duration.ofHours(24);
        private double similarityThreshold = 0.85;
        private DataSize maxCacheSize = DataSize.ofMegabytes(64);
        private int maxEntries = 10_000;
        private double evictionTarget = 0.9;
        private Duration defaultTtl = Duration.ofHours(24);
        private EvictionPolicy evictionPolicy = EvictionPolicy.HYBRID;
        private HybridWeightsConfig hybridWeights = new HybridWeightsConfig();
        private Duration recencyHalfLife = Duration.ofHours(24);
        private boolean compressionEnabled = true;
        private int compressionThreshold = 1000;
        private boolean warmupEnabled = true;
        private int topK = 5;
        private Duration semanticTimeout = Duration.ofMillis(500);
        private Duration optimizeInterval = Duration.ofMinutes(5);
        private Duration evictionInterval = Duration.ofMinutes(5);
        private int evictionBatchSize = 100;
        private Set<String> stopTokens = new HashSet<>(CacheSettings.DEFAULT_STOP_TOKENS);

        public CacheSettings toSettings() {
            return CacheSettings.builder()
                    .enableSemanticCaching(enableSemanticCaching)
                    .enableResponseCaching(enableResponseCaching)
                    .enableQueryNormalization(enableQueryNormalization)
                    .cacheByModel(cacheByModel)
                    .cacheByContext(cacheByContext)
                    .minResponseQuality(minResponseQuality)
                    .qualityThreshold(qualityThreshold)
                    .maxCacheAge(maxCacheAge)
                    .similarityThreshold(similarityThreshold)
                    .maxCacheSize(maxCacheSize.toBytes())
                    .maxEntries(maxEntries)
                    .evictionTarget(evictionTarget)
                    .defaultTtl(defaultTtl)
                    .evictionPolicy(evictionPolicy)
                    .hybridWeights(CacheSettings.HybridWeights.of(
                            hybridWeights.getRecency(),
                            hybridWeights.getFrequency(),
                            hybridWeights.getRelevance()))
                    .recencyHalfLife(recencyHalfLife)
                    .compressionEnabled(compressionEnabled)
                    .compressionThreshold(compressionThreshold)
                    .warmupEnabled(warmupEnabled)
                    .topK(topK)
                    .semanticTimeout(semanticTimeout)
                    .optimizeInterval(optimizeInterval)
                    .evictionBatchSize(evictionBatchSize)
                    .stopTokens(Set.copyOf(stopTokens))
                    .build();
        }
    }

    @Data
    public static class HybridWeightsConfig {
        private double recency = 1.0 / 3;
        private double frequency = 1.0 / 3;
        private double relevance = 1.0 / 3;
    }

    @Data
    public static class WarmingConfig {
        private WarmingMode mode = WarmingMode.SCHEDULED;
        private boolean scheduledEnabled = false;
        private Duration interval = Duration.ofHours(1);
        private int batchSize = 10;
        private int maxQueries = 100;
        private Duration assumedResponseTime = Duration.ofSeconds(1);
        private List<WarmingQuery> queries = new ArrayList<>();
    }

    @Data
    public static class EmbeddingsConfig {
        private String provider = "openai";
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "text-embedding-3-small";
        private int dimensions = 1536;
        private Duration timeout = Duration.ofSeconds(2);
        private int maxRetries = 2;
        private Duration retryBackoff = Duration.ofMillis(200);
        private int memoSize = 5000;
        private Duration memoExpireAfterWrite = Duration.ofHours(1);
    }

    @Data
    public static class IndexConfig {
        private String provider = "pgvector";
    }

    @Data
    public static class StoreConfig {
        private String provider = "redis";
    }

    @Data
    public static class RedisConfig {
        private String host = "localhost";
        private int port = 6379;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration commandTimeout = Duration.ofSeconds(5);
    }
}
