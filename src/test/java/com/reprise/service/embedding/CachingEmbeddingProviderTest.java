package com.reprise.service.embedding;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.reprise.exception.EmbeddingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CachingEmbeddingProvider.
 */
class CachingEmbeddingProviderTest {

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicBoolean failing = new AtomicBoolean();
    private CachingEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        EmbeddingProvider counting = new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                calls.incrementAndGet();
                if (failing.get()) {
                    throw new EmbeddingException("provider down");
                }
                return new float[]{text.length(), 1f};
            }

            @Override
            public int dimensions() {
                return 2;
            }

            @Override
            public String modelName() {
                return "counting";
            }
        };
        provider = new CachingEmbeddingProvider(counting, Caffeine.newBuilder().maximumSize(100).build());
    }

    @Test
    void testRepeatedTextEmbeddedOnce() {
        float[] first = provider.embed("capital france");
        float[] second = provider.embed("capital france");

        assertArrayEquals(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, provider.memoizedCount());
    }

    @Test
    void testDistinctTextsEmbeddedSeparately() {
        provider.embed("capital france");
        provider.embed("capital germany");

        assertEquals(2, calls.get());
    }

    @Test
    void testFailuresNotMemoized() {
        failing.set(true);
        assertThrows(EmbeddingException.class, () -> provider.embed("capital france"));

        failing.set(false);
        assertNotNull(provider.embed("capital france"));
        assertEquals(2, calls.get());
    }

    @Test
    void testDelegatesDescriptors() {
        assertEquals(2, provider.dimensions());
        assertEquals("counting", provider.modelName());
    }
}
