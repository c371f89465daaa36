package com.reprise.service.store;

import com.reprise.config.JacksonConfiguration;
import com.reprise.exception.CacheException;
import com.reprise.model.CacheEntry;
import com.reprise.model.EntryMetadata;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for EntryCodec.
 */
class EntryCodecTest {

    private final EntryCodec codec = new EntryCodec(JacksonConfiguration.createObjectMapper());

    @Test
    void testEntrySurvivesEncoding() {
        Instant created = Instant.parse("2026-01-01T00:00:00Z");
        CacheEntry entry = CacheEntry.builder()
                .id("cache_1")
                .queryHash("abc")
                .query("What is the capital of France?")
                .normalizedQuery("capital france")
                .partition("gpt-4")
                .queryEmbedding(new float[]{1f, 0f})
                .response("Paris".getBytes(StandardCharsets.UTF_8))
                .metadata(EntryMetadata.builder().model("gpt-4").quality(0.9).tags(List.of("geo")).build())
                .createdAt(created)
                .lastAccessed(created)
                .accessCount(3)
                .relevance(0.95)
                .relevanceSamples(2)
                .ttlSeconds(3600)
                .build();

        CacheEntry decoded = codec.decode(codec.encode(entry));

        assertEquals("cache_1", decoded.getId());
        assertEquals("capital france", decoded.getNormalizedQuery());
        assertArrayEquals(new float[]{1f, 0f}, decoded.getQueryEmbedding());
        assertEquals("Paris", new String(codec.responseOf(decoded), StandardCharsets.UTF_8));
        assertEquals(created, decoded.getCreatedAt());
        assertEquals(0.9, decoded.quality(), 1e-9);
        assertEquals(List.of("geo"), decoded.getMetadata().getTags());
        assertEquals(created.plusSeconds(3600), decoded.expiryInstant().orElseThrow());
    }

    @Test
    void testCompressedResponseRestored() {
        byte[] payload = "Paris is the capital of France. ".repeat(100).getBytes(StandardCharsets.UTF_8);
        byte[] compressed = codec.compress(payload);

        assertTrue(compressed.length < payload.length);

        CacheEntry entry = CacheEntry.builder().id("cache_2").response(compressed).compressed(true).build();
        assertArrayEquals(payload, codec.responseOf(entry));
    }

    @Test
    void testMissingResponseIsEmpty() {
        assertEquals(0, codec.responseOf(CacheEntry.builder().id("cache_3").build()).length);
    }

    @Test
    void testCorruptDataRejected() {
        assertThrows(CacheException.class, () -> codec.decode("not json".getBytes(StandardCharsets.UTF_8)));
        assertThrows(CacheException.class, () -> codec.decompress(new byte[]{1, 2, 3}));
    }
}
