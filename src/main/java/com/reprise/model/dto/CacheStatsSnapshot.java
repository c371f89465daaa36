package com.reprise.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view returned by {@code getStats}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsSnapshot {
    private CacheStatistics semantic;
    private PerformanceStatistics performance;
}
