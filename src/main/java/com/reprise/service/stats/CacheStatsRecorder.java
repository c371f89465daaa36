package com.reprise.service.stats;

import com.reprise.model.EvictionReason;
import com.reprise.model.dto.CacheStatistics;
import com.reprise.model.dto.CacheStatsSnapshot;
import com.reprise.model.dto.PerformanceStatistics;
import com.reprise.service.store.EvictionListener;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters behind {@code getStats}. Updated lock-free from any thread.
 */
@Slf4j
public class CacheStatsRecorder implements EvictionListener {

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final DoubleAdder similaritySum = new DoubleAdder();
    private final LongAdder timeSaved = new LongAdder();
    private final DoubleAdder costSaved = new DoubleAdder();
    private final LongAdder capacityEvictions = new LongAdder();
    private final LongAdder expiredEvictions = new LongAdder();
    private final LongAdder invalidated = new LongAdder();
    private final LongAdder admissionRejected = new LongAdder();
    private final LongAdder writeFailures = new LongAdder();
    private final LongAdder computeTimeOnMisses = new LongAdder();

    public void recordHit(double similarity, long timeSavedMs, double cost) {
        hits.increment();
        similaritySum.add(similarity);
        timeSaved.add(Math.max(0, timeSavedMs));
        costSaved.add(Math.max(0, cost));
    }

    public void recordMiss() {
        misses.increment();
    }

    public void recordAdmissionRejected() {
        admissionRejected.increment();
    }

    public void recordWriteFailure() {
        writeFailures.increment();
    }

    public void recordComputeTime(long computeMs) {
        computeTimeOnMisses.add(Math.max(0, computeMs));
    }

    @Override
    public void onEvicted(String entryId, EvictionReason reason, long bytes) {
        switch (reason) {
            case CAPACITY -> capacityEvictions.increment();
            case EXPIRED -> expiredEvictions.increment();
            case INVALIDATED -> invalidated.increment();
        }
    }

    public CacheStatsSnapshot snapshot(long totalEntries, long storageUsed,
                                       List<CacheStatistics.TopQuery> topQueries) {
        long hitCount = hits.sum();
        long missCount = misses.sum();
        long lookups = hitCount + missCount;
        long saved = timeSaved.sum();
        long compute = computeTimeOnMisses.sum();

        double hitRate = lookups > 0 ? (double) hitCount / lookups : 0.0;

        CacheStatistics semantic = CacheStatistics.builder()
                .totalEntries(totalEntries)
                .totalHits(hitCount)
                .totalMisses(missCount)
                .hitRate(hitRate)
                .missRate(lookups > 0 ? (double) missCount / lookups : 0.0)
                .averageSimilarity(hitCount > 0 ? similaritySum.sum() / hitCount : 0.0)
                .totalTimeSaved(saved)
                .totalCostSaved(costSaved.sum())
                .storageUsed(storageUsed)
                .evictionCount(capacityEvictions.sum() + expiredEvictions.sum())
                .capacityEvictions(capacityEvictions.sum())
                .expiredEvictions(expiredEvictions.sum())
                .invalidatedEntries(invalidated.sum())
                .admissionRejected(admissionRejected.sum())
                .writeFailures(writeFailures.sum())
                .totalComputeTimeOnMisses(compute)
                .topQueries(topQueries)
                .build();

        PerformanceStatistics performance = PerformanceStatistics.builder()
                .hitRate(hitRate)
                .averageTimeSaved(hitCount > 0 ? (double) saved / hitCount : 0.0)
                .totalCostSaved(costSaved.sum())
                .cacheEfficiency(saved + compute > 0 ? (double) saved / (saved + compute) : 0.0)
                .build();

        return CacheStatsSnapshot.builder()
                .semantic(semantic)
                .performance(performance)
                .build();
    }

    /**
     * Zero the hit, miss and similarity counters. Eviction, admission and savings counters keep growing.
     */
    public void resetLookupCounters() {
        hits.reset();
        misses.reset();
        similaritySum.reset();
        log.info("Cache lookup statistics reset");
    }
}
