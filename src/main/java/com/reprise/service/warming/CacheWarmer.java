package com.reprise.service.warming;

import com.reprise.config.CacheSettingsHolder;
import com.reprise.config.RepriseProperties;
import com.reprise.model.CacheRequest;
import com.reprise.model.EntryMetadata;
import com.reprise.model.RequestType;
import com.reprise.model.WarmingQuery;
import com.reprise.model.WarmupReport;
import com.reprise.service.ResponseCacheManager;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;

/**
 * Populates the cache ahead of demand.
 *
 * Queries run highest priority first, truncated to {@code maxQueries} and processed in
 * batches. Queries already cached are skipped; queries without an expected response are
 * reported back as unresolved.
 */
@Slf4j
public class CacheWarmer {

    static final String WARMUP_TAG = "warmup";

    private final ResponseCacheManager cacheManager;
    private final CacheSettingsHolder settings;
    private final RepriseProperties.WarmingConfig config;

    public CacheWarmer(ResponseCacheManager cacheManager, CacheSettingsHolder settings,
                       RepriseProperties.WarmingConfig config) {
        this.cacheManager = cacheManager;
        this.settings = settings;
        this.config = config;
    }

    /**
     * Warm from a source.
     */
    public WarmupReport warmup(WarmingQuerySource source) {
        log.info("Cache warming started: mode={}", source.mode());
        return warmup(source.nextQueries());
    }

    public WarmupReport warmup(List<WarmingQuery> queries) {
        if (!settings.get().isWarmupEnabled() || queries == null || queries.isEmpty()) {
            return WarmupReport.empty();
        }

        // Stable sort keeps list order among equal priorities.
        List<WarmingQuery> ordered = queries.stream()
                .sorted(Comparator.comparingInt(WarmingQuery::getPriority).reversed())
                .limit(Math.max(0, config.getMaxQueries()))
                .toList();

        int batchSize = Math.max(1, config.getBatchSize());
        WarmupReport.WarmupReportBuilder report = WarmupReport.builder();
        int processed = 0;
        int written = 0;
        int skipped = 0;

        for (int i = 0; i < ordered.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Cache warming interrupted after {} queries", processed);
                return report.processed(processed).written(written).skipped(skipped).aborted(true).build();
            }

            WarmingQuery query = ordered.get(i);
            processed++;

            if (query.getQuery() == null || query.getQuery().isBlank()) {
                skipped++;
            } else {
                CacheRequest request = CacheRequest.of(query.getQuery(),
                        query.getType() != null ? query.getType() : RequestType.TEXT_GENERATION);

                if (cacheManager.contains(request, query.getModel())) {
                    skipped++;
                } else if (query.getExpectedResponse() == null) {
                    report.unresolved(query);
                } else if (cacheManager.preload(request,
                        query.getExpectedResponse().getBytes(StandardCharsets.UTF_8), metadata(query))) {
                    written++;
                } else {
                    skipped++;
                }
            }

            if ((i + 1) % batchSize == 0) {
                log.debug("Warming batch done: {}/{}", i + 1, ordered.size());
                Thread.yield();
            }
        }

        WarmupReport result = report.processed(processed).written(written).skipped(skipped).build();
        log.info("Cache warming finished: processed={}, written={}, skipped={}, unresolved={}",
                processed, written, skipped, result.getUnresolved().size());
        return result;
    }

    private EntryMetadata metadata(WarmingQuery query) {
        return EntryMetadata.builder()
                .model(query.getModel())
                .responseTimeMs(config.getAssumedResponseTime().toMillis())
                .cost(0.0)
                .quality(1.0)
                .tags(List.of(WARMUP_TAG))
                .build();
    }
}
