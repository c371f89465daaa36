package com.reprise.service.stats;

import com.reprise.model.EvictionReason;
import com.reprise.model.dto.CacheStatistics;
import com.reprise.model.dto.CacheStatsSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CacheStatsRecorder.
 */
class CacheStatsRecorderTest {

    private CacheStatsRecorder recorder;

    @BeforeEach
    void setUp() {
        recorder = new CacheStatsRecorder();
    }

    @Test
    void testEmptySnapshot() {
        CacheStatsSnapshot snapshot = recorder.snapshot(0, 0, List.of());

        assertEquals(0.0, snapshot.getSemantic().getHitRate());
        assertEquals(0.0, snapshot.getSemantic().getAverageSimilarity());
        assertEquals(0.0, snapshot.getPerformance().getCacheEfficiency());
    }

    @Test
    void testRatesAndSavings() {
        recorder.recordHit(1.0, 800, 0.02);
        recorder.recordHit(0.9, 200, 0.01);
        recorder.recordMiss();
        recorder.recordMiss();
        recorder.recordComputeTime(1000);

        CacheStatistics.TopQuery top = CacheStatistics.TopQuery.builder().query("capital france").accessCount(2).build();
        CacheStatsSnapshot snapshot = recorder.snapshot(5, 2048, List.of(top));

        assertEquals(0.5, snapshot.getSemantic().getHitRate(), 1e-9);
        assertEquals(0.5, snapshot.getSemantic().getMissRate(), 1e-9);
        assertEquals(0.95, snapshot.getSemantic().getAverageSimilarity(), 1e-9);
        assertEquals(1000, snapshot.getSemantic().getTotalTimeSaved());
        assertEquals(0.03, snapshot.getSemantic().getTotalCostSaved(), 1e-9);
        assertEquals(5, snapshot.getSemantic().getTotalEntries());
        assertEquals(2048, snapshot.getSemantic().getStorageUsed());
        assertEquals(List.of(top), snapshot.getSemantic().getTopQueries());
        assertEquals(500.0, snapshot.getPerformance().getAverageTimeSaved(), 1e-9);
        assertEquals(0.5, snapshot.getPerformance().getCacheEfficiency(), 1e-9);
    }

    @Test
    void testEvictionsCountedByReason() {
        recorder.onEvicted("cache_1", EvictionReason.CAPACITY, 100);
        recorder.onEvicted("cache_2", EvictionReason.EXPIRED, 100);
        recorder.onEvicted("cache_3", EvictionReason.INVALIDATED, 100);

        CacheStatistics semantic = recorder.snapshot(0, 0, List.of()).getSemantic();

        assertEquals(2, semantic.getEvictionCount());
        assertEquals(1, semantic.getCapacityEvictions());
        assertEquals(1, semantic.getExpiredEvictions());
        assertEquals(1, semantic.getInvalidatedEntries());
    }

    @Test
    void testResetKeepsSavingsAndEvictions() {
        recorder.recordHit(0.9, 100, 0.01);
        recorder.recordMiss();
        recorder.onEvicted("cache_1", EvictionReason.CAPACITY, 100);

        recorder.resetLookupCounters();
        CacheStatistics semantic = recorder.snapshot(0, 0, List.of()).getSemantic();

        assertEquals(0, semantic.getTotalHits());
        assertEquals(0, semantic.getTotalMisses());
        assertEquals(0.0, semantic.getAverageSimilarity());
        assertEquals(100, semantic.getTotalTimeSaved());
        assertEquals(1, semantic.getCapacityEvictions());
    }

    @Test
    void testNegativeInputsIgnored() {
        recorder.recordHit(1.0, -50, -1.0);
        recorder.recordComputeTime(-10);

        CacheStatistics semantic = recorder.snapshot(0, 0, List.of()).getSemantic();

        assertEquals(0, semantic.getTotalTimeSaved());
        assertEquals(0.0, semantic.getTotalCostSaved());
        assertEquals(0, semantic.getTotalComputeTimeOnMisses());
    }
}
