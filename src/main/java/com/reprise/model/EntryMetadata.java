package com.reprise.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Facts about how a cached response was produced.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EntryMetadata {

    private String model;

    /**
     * Wall time the original generation took. Credited as time saved on every hit.
     */
    private long responseTimeMs;

    private TokenUsage tokenUsage;

    /**
     * Cost of the original generation. Credited as cost saved on every hit.
     */
    private double cost;

    /**
     * Quality in [0, 1]. Null on input means "not scored by the caller".
     */
    private Double quality;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> context = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TokenUsage {
        private int prompt;
        private int completion;
        private int total;
    }
}
