package com.reprise.support;

import com.reprise.exception.EmbeddingException;
import com.reprise.service.embedding.EmbeddingProvider;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Embedding provider with scripted vectors.
 *
 * Registered texts return their vector padded to {@code dimensions}. Any other text gets
 * its own basis vector counted down from the last dimension, so unrelated texts are orthogonal.
 */
public class FakeEmbeddingProvider implements EmbeddingProvider {

    private final int dimensions;
    private final Map<String, float[]> vectors = new ConcurrentHashMap<>();
    private final AtomicInteger nextBasis;
    private final AtomicInteger calls = new AtomicInteger();

    private volatile boolean failing;
    private volatile Duration delay = Duration.ZERO;

    public FakeEmbeddingProvider(int dimensions) {
        this.dimensions = dimensions;
        this.nextBasis = new AtomicInteger(dimensions - 1);
    }

    public FakeEmbeddingProvider put(String text, float... values) {
        float[] vector = new float[dimensions];
        System.arraycopy(values, 0, vector, 0, values.length);
        vectors.put(text, vector);
        return this;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public void setDelay(Duration delay) {
        this.delay = delay;
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public float[] embed(String text) {
        calls.incrementAndGet();
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EmbeddingException("Interrupted while embedding");
            }
        }
        if (failing) {
            throw new EmbeddingException("Embedding service down");
        }
        return vectors.computeIfAbsent(text, t -> {
            int basis = nextBasis.getAndDecrement();
            if (basis < 0) {
                throw new EmbeddingException("No basis vector left for: " + t);
            }
            float[] vector = new float[dimensions];
            vector[basis] = 1.0f;
            return vector;
        }).clone();
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String modelName() {
        return "fake";
    }
}
