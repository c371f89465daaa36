package com.reprise.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.reprise.repository.DurableStore;
import com.reprise.repository.InMemoryDurableStore;
import com.reprise.repository.RedisDurableStore;
import com.reprise.repository.VectorRecordRepository;
import com.reprise.service.ResponseCacheManager;
import com.reprise.service.ResponseQualityEstimator;
import com.reprise.service.embedding.CachingEmbeddingProvider;
import com.reprise.service.embedding.EmbeddingProvider;
import com.reprise.service.embedding.OpenAIEmbeddingProvider;
import com.reprise.service.eviction.CacheMaintenanceScheduler;
import com.reprise.service.eviction.EvictionEngine;
import com.reprise.service.eviction.EvictionScorer;
import com.reprise.service.index.InMemoryVectorIndex;
import com.reprise.service.index.PgVectorIndex;
import com.reprise.service.index.VectorIndex;
import com.reprise.service.normalization.KeyNormalizer;
import com.reprise.service.stats.CacheStatsRecorder;
import com.reprise.service.store.EntryCodec;
import com.reprise.service.store.KeyLocks;
import com.reprise.service.store.SimilarityCacheStore;
import com.reprise.service.warming.CacheWarmer;
import com.reprise.service.warming.ConfiguredWarmingQuerySource;
import com.reprise.service.warming.WarmingQuerySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the cache components. Every collaborator is constructed here and passed in
 * explicitly.
 */
@Slf4j
@Configuration
public class CacheComponentsConfiguration {

    private final RepriseProperties properties;

    public CacheComponentsConfiguration(RepriseProperties properties) {
        this.properties = properties;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheSettingsHolder cacheSettingsHolder() {
        CacheSettings settings = properties.getCache().toSettings();
        log.info("Cache settings: policy={}, threshold={}, maxCacheSize={}B, maxEntries={}",
                settings.getEvictionPolicy(), settings.getSimilarityThreshold(),
                settings.getMaxCacheSize(), settings.getMaxEntries());
        return new CacheSettingsHolder(settings);
    }

    @Bean
    public KeyNormalizer keyNormalizer() {
        return new KeyNormalizer();
    }

    @Bean
    public EntryCodec entryCodec(ObjectMapper objectMapper) {
        return new EntryCodec(objectMapper);
    }

    @Bean
    public KeyLocks keyLocks() {
        return new KeyLocks();
    }

    @Bean
    @ConditionalOnProperty(prefix = "reprise.store", name = "provider", havingValue = "redis", matchIfMissing = true)
    public DurableStore redisDurableStore(RedisTemplate<String, byte[]> redisTemplate,
                                          StringRedisTemplate stringRedisTemplate) {
        return new RedisDurableStore(redisTemplate, stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "reprise.store", name = "provider", havingValue = "memory")
    public DurableStore inMemoryDurableStore() {
        log.info("Using in-memory durable store");
        return new InMemoryDurableStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "reprise.index", name = "provider", havingValue = "pgvector", matchIfMissing = true)
    public VectorIndex pgVectorIndex(VectorRecordRepository repository) {
        return new PgVectorIndex(repository);
    }

    @Bean
    @ConditionalOnProperty(prefix = "reprise.index", name = "provider", havingValue = "memory")
    public VectorIndex inMemoryVectorIndex() {
        log.info("Using in-memory vector index");
        return new InMemoryVectorIndex();
    }

    @Bean
    public EmbeddingProvider embeddingProvider(WebClient embeddingWebClient, Cache<String, float[]> embeddingMemo) {
        RepriseProperties.EmbeddingsConfig embeddings = properties.getEmbeddings();
        if (!"openai".equalsIgnoreCase(embeddings.getProvider())) {
            throw new IllegalStateException("Unsupported embedding provider: " + embeddings.getProvider());
        }
        log.info("Embedding provider: {} ({}d) at {}",
                embeddings.getModel(), embeddings.getDimensions(), embeddings.getBaseUrl());
        return new CachingEmbeddingProvider(new OpenAIEmbeddingProvider(embeddingWebClient, embeddings), embeddingMemo);
    }

    @Bean
    public CacheStatsRecorder cacheStatsRecorder() {
        return new CacheStatsRecorder();
    }

    @Bean(destroyMethod = "close")
    public SimilarityCacheStore similarityCacheStore(
            DurableStore durableStore,
            VectorIndex vectorIndex,
            EmbeddingProvider embeddingProvider,
            EntryCodec entryCodec,
            KeyLocks keyLocks,
            CacheSettingsHolder cacheSettingsHolder,
            Clock clock,
            CacheStatsRecorder cacheStatsRecorder) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("reprise-semantic-");
        threadFactory.setDaemon(true);
        ExecutorService semanticExecutor = Executors.newFixedThreadPool(
                Runtime.getRuntime().availableProcessors(), threadFactory);

        return new SimilarityCacheStore(durableStore, vectorIndex, embeddingProvider, entryCodec, keyLocks,
                cacheSettingsHolder, clock, semanticExecutor, cacheStatsRecorder);
    }

    @Bean
    public EvictionScorer evictionScorer() {
        return new EvictionScorer();
    }

    @Bean
    public EvictionEngine evictionEngine(SimilarityCacheStore store, EvictionScorer scorer,
                                         CacheSettingsHolder cacheSettingsHolder, Clock clock) {
        return new EvictionEngine(store, scorer, cacheSettingsHolder, clock);
    }

    @Bean
    public ResponseQualityEstimator responseQualityEstimator() {
        return new ResponseQualityEstimator();
    }

    @Bean
    public ResponseCacheManager responseCacheManager(
            KeyNormalizer keyNormalizer,
            SimilarityCacheStore store,
            EvictionEngine evictionEngine,
            CacheStatsRecorder cacheStatsRecorder,
            ResponseQualityEstimator responseQualityEstimator,
            CacheSettingsHolder cacheSettingsHolder,
            Clock clock) {
        return new ResponseCacheManager(keyNormalizer, store, evictionEngine, cacheStatsRecorder,
                responseQualityEstimator, cacheSettingsHolder, clock);
    }

    @Bean
    public WarmingQuerySource warmingQuerySource() {
        return new ConfiguredWarmingQuerySource(properties.getWarming());
    }

    @Bean
    public CacheWarmer cacheWarmer(ResponseCacheManager responseCacheManager,
                                   CacheSettingsHolder cacheSettingsHolder) {
        return new CacheWarmer(responseCacheManager, cacheSettingsHolder, properties.getWarming());
    }

    @Bean
    public CacheMaintenanceScheduler cacheMaintenanceScheduler(EvictionEngine evictionEngine,
                                                               CacheWarmer cacheWarmer,
                                                               WarmingQuerySource warmingQuerySource) {
        return new CacheMaintenanceScheduler(evictionEngine, cacheWarmer, warmingQuerySource,
                properties.getWarming());
    }
}
