package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Derived performance figures.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PerformanceStatistics {

    private double hitRate;

    /**
     * Milliseconds saved per hit.
     */
    private double averageTimeSaved;

    private double totalCostSaved;

    /**
     * Fraction of total latency avoided: saved / (saved + compute time on misses).
     */
    private double cacheEfficiency;
}
