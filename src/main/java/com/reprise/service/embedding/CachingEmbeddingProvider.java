package com.reprise.service.embedding;

import com.github.benmanes.caffeine.cache.Cache;

/**
 * Memoizes embeddings of recently seen texts in a Caffeine cache so repeated queries do not pay
 * the provider round trip twice. Failures are not memoized.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingProvider delegate;
    private final Cache<String, float[]> memo;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, Cache<String, float[]> memo) {
        this.delegate = delegate;
        this.memo = memo;
    }

    @Override
    public float[] embed(String text) {
        return memo.get(text, delegate::embed);
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    public long memoizedCount() {
        return memo.estimatedSize();
    }
}
