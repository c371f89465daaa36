package com.reprise.service;

import com.reprise.config.CacheSettings;
import com.reprise.config.CacheSettingsHolder;
import com.reprise.config.CacheSettingsPatch;
import com.reprise.exception.CacheException;
import com.reprise.exception.CacheValidationException;
import com.reprise.model.CacheHit;
import com.reprise.model.CacheKey;
import com.reprise.model.CacheRequest;
import com.reprise.model.CacheResult;
import com.reprise.model.CacheSource;
import com.reprise.model.EntryMetadata;
import com.reprise.model.OptimizationResult;
import com.reprise.model.dto.CacheStatsSnapshot;
import com.reprise.service.eviction.EvictionEngine;
import com.reprise.service.normalization.KeyNormalizer;
import com.reprise.service.stats.CacheStatsRecorder;
import com.reprise.service.store.SimilarityCacheStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the response cache.
 *
 * Flow:
 * 1. Validate the request and build its key
 * 2. Exact lookup, then similarity lookup (store)
 * 3. On a miss the caller generates the response and calls {@link #set}
 * 4. Quality gate, store, then enforce capacity if a limit is exceeded
 *
 * Read failures degrade to a miss. Write failures are logged and counted.
 */
@Slf4j
public class ResponseCacheManager {

    private static final int TOP_QUERIES = 10;

    private final KeyNormalizer normalizer;
    private final SimilarityCacheStore store;
    private final EvictionEngine evictionEngine;
    private final CacheStatsRecorder stats;
    private final ResponseQualityEstimator qualityEstimator;
    private final CacheSettingsHolder settings;
    private final Clock clock;

    private final AtomicReference<Instant> lastOptimizedAt = new AtomicReference<>();

    public ResponseCacheManager(
            KeyNormalizer normalizer,
            SimilarityCacheStore store,
            EvictionEngine evictionEngine,
            CacheStatsRecorder stats,
            ResponseQualityEstimator qualityEstimator,
            CacheSettingsHolder settings,
            Clock clock) {
        this.normalizer = normalizer;
        this.store = store;
        this.evictionEngine = evictionEngine;
        this.stats = stats;
        this.qualityEstimator = qualityEstimator;
        this.settings = settings;
        this.clock = clock;
    }

    public CacheResult get(CacheRequest request) {
        return get(request, null);
    }

    /**
     * Look up a cached response.
     *
     * @param request request to answer
     * @param model   model the caller would generate with, may be null
     * @return hit with response, similarity and savings, or a miss
     * @throws CacheValidationException if the request or its query is missing
     */
    public CacheResult get(CacheRequest request, String model) {
        validate(request);

        CacheKey key = normalizer.normalize(request, model, settings.get());
        if (key.isEmpty()) {
            stats.recordMiss();
            return CacheResult.miss();
        }

        Optional<CacheHit> hit;
        try {
            hit = store.get(key);
        } catch (CacheException e) {
            log.warn("Cache lookup failed, treating as miss: request={}", request.getId(), e);
            hit = Optional.empty();
        }

        if (hit.isEmpty()) {
            stats.recordMiss();
            log.debug("Cache miss: request={}", request.getId());
            return CacheResult.miss();
        }

        CacheHit cacheHit = hit.get();
        stats.recordHit(cacheHit.getSimilarity(), cacheHit.getTimeSaved(), cacheHit.getCostSaved());

        log.debug("Cache hit: request={}, exact={}, similarity={}",
                request.getId(), cacheHit.isExact(), String.format("%.4f", cacheHit.getSimilarity()));

        return CacheResult.builder()
                .hit(true)
                .response(cacheHit.getEntry().getResponse())
                .similarity(cacheHit.getSimilarity())
                .timeSaved(cacheHit.getTimeSaved())
                .costSaved(cacheHit.getCostSaved())
                .source(cacheHit.isExact() ? CacheSource.EXACT : CacheSource.SEMANTIC)
                .build();
    }

    public boolean set(CacheRequest request, String response, EntryMetadata metadata) {
        return set(request, response.getBytes(StandardCharsets.UTF_8), metadata);
    }

    /**
     * Store a freshly generated response. The response time in {@code metadata} is
     * credited as compute spent on a miss.
     *
     * @return true if the response was stored
     * @throws CacheValidationException if the request or its query is missing
     */
    public boolean set(CacheRequest request, byte[] response, EntryMetadata metadata) {
        validate(request);
        if (metadata != null) {
            stats.recordComputeTime(metadata.getResponseTimeMs());
        }
        return write(request, response, metadata);
    }

    /**
     * Store a response that was not generated for a miss. Used by warming.
     *
     * @return true if the response was stored
     */
    public boolean preload(CacheRequest request, byte[] response, EntryMetadata metadata) {
        validate(request);
        return write(request, response, metadata);
    }

    public boolean contains(CacheRequest request, String model) {
        validate(request);
        CacheKey key = normalizer.normalize(request, model, settings.get());
        return !key.isEmpty() && store.contains(key);
    }

    public int invalidate() {
        return invalidate(null, null);
    }

    /**
     * Remove entries whose query contains {@code pattern}. With model caching on, a
     * model restricts removal to that model's entries. With neither argument every entry
     * is removed and the lookup counters are reset.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern, String model) {
        String scope = settings.get().isCacheByModel() ? model : null;
        int removed = store.invalidate(pattern, scope);

        if ((pattern == null || pattern.isBlank()) && scope == null) {
            stats.resetLookupCounters();
        }
        return removed;
    }

    public CacheStatsSnapshot getStats() {
        return stats.snapshot(store.entryCount(), store.storageUsed(), store.topQueries(TOP_QUERIES));
    }

    /**
     * Purge, compress and enforce capacity. Runs at most once per optimize interval;
     * calls inside the interval return a skipped result.
     */
    public OptimizationResult optimize() {
        Instant now = clock.instant();
        Duration interval = settings.get().getOptimizeInterval();

        Instant previous = lastOptimizedAt.get();
        if (previous != null && now.isBefore(previous.plus(interval))) {
            log.debug("Optimize skipped, last run at {}", previous);
            return OptimizationResult.skipped();
        }
        if (!lastOptimizedAt.compareAndSet(previous, now)) {
            return OptimizationResult.skipped();
        }

        OptimizationResult result = store.optimize().plus(evictionEngine.enforceCapacity());
        log.info("Cache optimized: evicted={}, reclaimed={}B, took={}ms",
                result.getEntriesEvicted(), result.getStorageReclaimed(), result.getOptimizationTime());
        return result;
    }

    public CacheSettings updateConfig(CacheSettingsPatch patch) {
        return settings.update(patch);
    }

    public CacheSettings currentSettings() {
        return settings.get();
    }

    private boolean write(CacheRequest request, byte[] response, EntryMetadata metadata) {
        CacheSettings current = settings.get();
        if (!current.isEnableResponseCaching()) {
            return false;
        }
        if (response == null) {
            throw new CacheValidationException("Response must not be null");
        }

        EntryMetadata base = metadata != null ? metadata : EntryMetadata.builder().build();

        if (base.getQuality() != null && base.getQuality() < current.getMinResponseQuality()) {
            stats.recordAdmissionRejected();
            log.debug("Response rejected by quality gate: request={}, quality={}, minimum={}",
                    request.getId(), base.getQuality(), current.getMinResponseQuality());
            return false;
        }

        CacheKey key = normalizer.normalize(request, base.getModel(), current);
        if (key.isEmpty()) {
            return false;
        }

        double quality = base.getQuality() != null
                ? base.getQuality()
                : qualityEstimator.estimate(new String(response, StandardCharsets.UTF_8));

        EntryMetadata stored = base.toBuilder()
                .quality(quality)
                .tags(tags(request, base))
                .context(new ArrayList<>(key.getContext()))
                .build();

        try {
            store.set(key, response, stored);
        } catch (CacheException e) {
            stats.recordWriteFailure();
            log.error("Failed to store response: request={}", request.getId(), e);
            return false;
        }

        try {
            if (evictionEngine.isOverCapacity()) {
                evictionEngine.enforceCapacity();
            }
        } catch (CacheException e) {
            log.warn("Capacity enforcement failed after write: request={}", request.getId(), e);
        }
        return true;
    }

    private List<String> tags(CacheRequest request, EntryMetadata metadata) {
        Set<String> tags = new LinkedHashSet<>();
        if (request.getType() != null) {
            tags.add(request.getType().getValue());
        }
        if (request.getTags() != null) {
            tags.addAll(request.getTags());
        }
        if (metadata.getTags() != null) {
            tags.addAll(metadata.getTags());
        }
        return new ArrayList<>(tags);
    }

    private void validate(CacheRequest request) {
        if (request == null) {
            throw new CacheValidationException("Request must not be null");
        }
        if (request.getQuery() == null) {
            throw new CacheValidationException("Request query must not be null");
        }
    }
}
