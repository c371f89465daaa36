package com.reprise.model;

import lombok.Builder;
import lombok.Value;

/**
 * Cumulative effect of an optimize or eviction run.
 */
@Value
@Builder
public class OptimizationResult {

    int entriesEvicted;

    /**
     * Bytes freed by removals and recompression.
     */
    long storageReclaimed;

    /**
     * Duration of the run in milliseconds.
     */
    long optimizationTime;

    boolean skipped;

    public static OptimizationResult empty() {
        return OptimizationResult.builder().build();
    }

    public static OptimizationResult skipped() {
        return OptimizationResult.builder().skipped(true).build();
    }

    public OptimizationResult plus(OptimizationResult other) {
        return OptimizationResult.builder()
                .entriesEvicted(entriesEvicted + other.entriesEvicted)
                .storageReclaimed(storageReclaimed + other.storageReclaimed)
                .optimizationTime(optimizationTime + other.optimizationTime)
                .skipped(skipped && other.skipped)
                .build();
    }
}
