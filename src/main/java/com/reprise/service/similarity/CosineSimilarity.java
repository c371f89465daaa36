package com.reprise.service.similarity;

/**
 * Cosine similarity between query embeddings.
 *
 * Convention used everywhere in the cache: {@code dot(a, b) / (|a| * |b|)} over the raw vectors,
 * clamped to [-1, 1], with negative values floored to 0 so that results live in [0, 1].
 * No (sim + 1) / 2 remapping is applied: a cosine of 0.92 is reported as 0.92 and compared
 * against the similarity threshold as such.
 */
public final class CosineSimilarity {

    private CosineSimilarity() {
    }

    /**
     * Similarity in [0, 1]. Mismatched dimensions, null or zero vectors score 0.
     */
    public static double similarity(float[] a, float[] b) {
        double cosine = cosine(a, b);
        return cosine < 0.0 ? 0.0 : cosine;
    }

    /**
     * Raw cosine clamped to [-1, 1].
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length || a.length == 0) {
            return 0.0;
        }

        double dotProduct = 0.0;
        double norm1 = 0.0;
        double norm2 = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += (double) a[i] * b[i];
            norm1 += (double) a[i] * a[i];
            norm2 += (double) b[i] * b[i];
        }

        if (norm1 == 0.0 || norm2 == 0.0) {
            return 0.0;
        }

        double cosine = dotProduct / (Math.sqrt(norm1) * Math.sqrt(norm2));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }
}
