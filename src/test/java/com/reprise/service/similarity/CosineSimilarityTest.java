package com.reprise.service.similarity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CosineSimilarity.
 */
class CosineSimilarityTest {

    @Test
    void testIdenticalVectors() {
        float[] v = {0.3f, 0.4f, 0.5f};
        assertEquals(1.0, CosineSimilarity.similarity(v, v), 1e-6);
    }

    @Test
    void testNoRemapping() {
        assertEquals(0.92, CosineSimilarity.similarity(new float[]{1f, 0f}, new float[]{0.92f, 0.39192f}), 1e-4);
    }

    @Test
    void testScaleInvariant() {
        assertEquals(1.0, CosineSimilarity.similarity(new float[]{1f, 2f}, new float[]{10f, 20f}), 1e-6);
    }

    @Test
    void testNegativeFlooredToZero() {
        float[] a = {1f, 0f};
        float[] b = {-1f, 0f};
        assertEquals(-1.0, CosineSimilarity.cosine(a, b), 1e-9);
        assertEquals(0.0, CosineSimilarity.similarity(a, b));
    }

    @Test
    void testDegenerateInputs() {
        assertEquals(0.0, CosineSimilarity.similarity(null, new float[]{1f}));
        assertEquals(0.0, CosineSimilarity.similarity(new float[]{1f, 0f}, new float[]{1f}));
        assertEquals(0.0, CosineSimilarity.similarity(new float[]{0f, 0f}, new float[]{1f, 1f}));
        assertEquals(0.0, CosineSimilarity.similarity(new float[0], new float[0]));
    }
}
