package com.reprise.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one warmup run.
 */
@Value
@Builder
public class WarmupReport {

    int processed;

    int written;

    int skipped;

    /**
     * Queries without an expected response. The caller must generate and set them.
     */
    @Singular("unresolved")
    List<WarmingQuery> unresolved;

    boolean aborted;

    public static WarmupReport empty() {
        return WarmupReport.builder().build();
    }
}
