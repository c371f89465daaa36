package com.reprise.service.eviction;

import com.reprise.config.CacheSettings;
import com.reprise.model.EvictionCandidate;
import com.reprise.model.EvictionPolicy;

import java.util.Comparator;
import java.util.List;

/**
 * Eviction scoring. Lower scores are evicted first; ties break on entry id.
 *
 * Policies:
 * - LRU: last access time
 * - LFU: access count
 * - SEMANTIC_RELEVANCE: rolling similarity of the hits the entry served
 * - HYBRID: weighted sum of recency, frequency and relevance, each in [0, 1]
 *
 * Hybrid terms:
 * recency   = exp(-idleHours / halfLifeHours)
 * frequency = 1 - 1 / (1 + accessCount)
 * relevance = rolling hit similarity
 */
public class EvictionScorer {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    public double score(EvictionCandidate candidate, CacheSettings settings, long nowMillis) {
        EvictionPolicy policy = settings.getEvictionPolicy();
        return switch (policy) {
            case LRU -> candidate.getLastAccessedMillis();
            case LFU -> candidate.getAccessCount();
            case SEMANTIC_RELEVANCE -> candidate.getRelevance();
            case HYBRID -> hybridScore(candidate, settings, nowMillis);
        };
    }

    /**
     * Candidates in eviction order, first victim first.
     */
    public List<EvictionCandidate> rank(List<EvictionCandidate> candidates, CacheSettings settings, long nowMillis) {
        return candidates.stream()
                .map(candidate -> new Ranked(candidate, score(candidate, settings, nowMillis)))
                .sorted(Comparator.comparingDouble(Ranked::score)
                        .thenComparing(ranked -> ranked.candidate().getId()))
                .map(Ranked::candidate)
                .toList();
    }

    double recencyScore(long lastAccessedMillis, long nowMillis, double halfLifeHours) {
        double idleHours = Math.max(0, nowMillis - lastAccessedMillis) / MILLIS_PER_HOUR;
        if (halfLifeHours <= 0) {
            return idleHours == 0 ? 1.0 : 0.0;
        }

        // Exponential decay: score = exp(-idleHours / halfLife)
        return Math.exp(-idleHours / halfLifeHours);
    }

    double frequencyScore(long accessCount) {
        return 1.0 - 1.0 / (1.0 + Math.max(0, accessCount));
    }

    private double hybridScore(EvictionCandidate candidate, CacheSettings settings, long nowMillis) {
        CacheSettings.HybridWeights weights = settings.getHybridWeights();
        double halfLifeHours = settings.getRecencyHalfLife().toMillis() / MILLIS_PER_HOUR;

        double recency = recencyScore(candidate.getLastAccessedMillis(), nowMillis, halfLifeHours);
        double frequency = frequencyScore(candidate.getAccessCount());
        double relevance = Math.max(0.0, Math.min(1.0, candidate.getRelevance()));

        return weights.getRecency() * recency
                + weights.getFrequency() * frequency
                + weights.getRelevance() * relevance;
    }

    private record Ranked(EvictionCandidate candidate, double score) {
    }
}
