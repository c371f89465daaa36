package com.reprise.service;

import java.util.Locale;

/**
 * Heuristic quality score for responses stored without a caller-supplied quality.
 *
 * Starts at 0.5 and adjusts:
 * +0.1 longer than 100 chars, +0.1 longer than 500 chars,
 * +0.1 not truncated ("..." or "[truncated]"), +0.1 has a sentence or line break,
 * -0.2 mentions "error" or "sorry".
 * Result clamped to [0, 1].
 */
public class ResponseQualityEstimator {

    private static final double BASE_SCORE = 0.5;

    public double estimate(String response) {
        if (response == null || response.isBlank()) {
            return 0.0;
        }

        double score = BASE_SCORE;

        if (response.length() > 100) {
            score += 0.1;
        }
        if (response.length() > 500) {
            score += 0.1;
        }
        if (!response.contains("...") && !response.contains("[truncated]")) {
            score += 0.1;
        }
        if (response.contains("\n") || response.contains(".")) {
            score += 0.1;
        }

        String lower = response.toLowerCase(Locale.ROOT);
        if (lower.contains("error") || lower.contains("sorry")) {
            score -= 0.2;
        }

        return Math.max(0.0, Math.min(1.0, score));
    }
}
