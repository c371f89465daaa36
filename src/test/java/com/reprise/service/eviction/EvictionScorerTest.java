package com.reprise.service.eviction;

import com.reprise.config.CacheSettings;
import com.reprise.model.EvictionCandidate;
import com.reprise.model.EvictionPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EvictionScorer.
 */
class EvictionScorerTest {

    private static final long NOW = 1_800_000_000_000L;
    private static final long HOUR = 3_600_000L;

    private EvictionScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new EvictionScorer();
    }

    @Test
    void testRecencyDecaysExponentially() {
        assertEquals(1.0, scorer.recencyScore(NOW, NOW, 24), 1e-9);
        assertEquals(Math.exp(-1), scorer.recencyScore(NOW - 24 * HOUR, NOW, 24), 1e-9);
        assertTrue(scorer.recencyScore(NOW - 48 * HOUR, NOW, 24) < scorer.recencyScore(NOW - 24 * HOUR, NOW, 24));
    }

    @Test
    void testFrequencyScore() {
        assertEquals(0.0, scorer.frequencyScore(0), 1e-9);
        assertEquals(0.5, scorer.frequencyScore(1), 1e-9);
        assertEquals(0.9, scorer.frequencyScore(9), 1e-9);
    }

    @Test
    void testHybridCombinesWeightedTerms() {
        CacheSettings settings = CacheSettings.defaults().toBuilder()
                .evictionPolicy(EvictionPolicy.HYBRID)
                .hybridWeights(CacheSettings.HybridWeights.of(0.5, 0.25, 0.25))
                .recencyHalfLife(Duration.ofHours(24))
                .build();
        EvictionCandidate candidate = candidate("a", NOW, 1, 0.8);

        double expected = 0.5 * 1.0 + 0.25 * 0.5 + 0.25 * 0.8;
        assertEquals(expected, scorer.score(candidate, settings, NOW), 1e-9);
    }

    @Test
    void testRankOrdersByPolicy() {
        List<EvictionCandidate> candidates = List.of(
                candidate("a", NOW - HOUR, 10, 0.9),
                candidate("b", NOW - 3 * HOUR, 2, 0.95),
                candidate("c", NOW - 2 * HOUR, 0, 0.0));

        assertEquals(List.of("b", "c", "a"), ids(scorer.rank(candidates, policy(EvictionPolicy.LRU), NOW)));
        assertEquals(List.of("c", "b", "a"), ids(scorer.rank(candidates, policy(EvictionPolicy.LFU), NOW)));
        assertEquals(List.of("c", "a", "b"),
                ids(scorer.rank(candidates, policy(EvictionPolicy.SEMANTIC_RELEVANCE), NOW)));
        assertEquals("c", scorer.rank(candidates, policy(EvictionPolicy.HYBRID), NOW).get(0).getId());
    }

    @Test
    void testTiesBreakOnId() {
        List<EvictionCandidate> candidates = List.of(
                candidate("entry-b", NOW, 3, 0.5),
                candidate("entry-a", NOW, 3, 0.5));

        assertEquals(List.of("entry-a", "entry-b"), ids(scorer.rank(candidates, policy(EvictionPolicy.LFU), NOW)));
    }

    private static CacheSettings policy(EvictionPolicy policy) {
        return CacheSettings.defaults().toBuilder().evictionPolicy(policy).build();
    }

    private static EvictionCandidate candidate(String id, long lastAccessed, long accessCount, double relevance) {
        return EvictionCandidate.builder()
                .id(id)
                .lastAccessedMillis(lastAccessed)
                .accessCount(accessCount)
                .relevance(relevance)
                .sizeBytes(100)
                .build();
    }

    private static List<String> ids(List<EvictionCandidate> candidates) {
        return candidates.stream().map(EvictionCandidate::getId).toList();
    }
}
