package com.reprise.repository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryDurableStore.
 */
class InMemoryDurableStoreTest {

    private InMemoryDurableStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDurableStore();
    }

    @Test
    void testValues() {
        store.set("reprise:entry:1", "one".getBytes(StandardCharsets.UTF_8));

        assertEquals("one", new String(store.get("reprise:entry:1").orElseThrow(), StandardCharsets.UTF_8));
        assertTrue(store.get("reprise:entry:2").isEmpty());

        assertTrue(store.delete("reprise:entry:1"));
        assertFalse(store.delete("reprise:entry:1"));
    }

    @Test
    void testKeysByPrefix() {
        store.set("reprise:entry:1", new byte[]{1});
        store.set("reprise:hash:abc", new byte[]{1});
        store.zadd("reprise:idx:size", "1", 10);

        assertEquals(Set.of("reprise:entry:1"), store.keys("reprise:entry:"));
        assertEquals(3, store.keys("reprise:").size());
    }

    @Test
    void testCounters() {
        assertEquals(0, store.counter("reprise:stat:storage-bytes"));
        assertEquals(100, store.incrBy("reprise:stat:storage-bytes", 100));
        assertEquals(60, store.incrBy("reprise:stat:storage-bytes", -40));
        assertEquals(60, store.counter("reprise:stat:storage-bytes"));
        assertEquals("60", new String(store.get("reprise:stat:storage-bytes").orElseThrow(), StandardCharsets.UTF_8));
    }

    @Test
    void testSortedSetRanges() {
        store.zadd("idx", "c", 3);
        store.zadd("idx", "a", 1);
        store.zadd("idx", "b", 2);
        store.zadd("idx", "b2", 2);

        assertEquals(List.of("a", "b", "b2"), members(store.zrangeWithScores("idx", 3)));
        assertEquals(List.of("c", "b2"), members(store.zrevrangeWithScores("idx", 2)));
        assertEquals(List.of("b", "b2"), members(store.zrangeByScore("idx", 2, 2, 10)));
        assertEquals(List.of("a"), members(store.zrangeByScore("idx", Double.NEGATIVE_INFINITY, 2, 1)));
        assertEquals(4, store.zcard("idx"));
    }

    @Test
    void testSortedSetUpdateAndRemove() {
        store.zadd("idx", "a", 1);
        store.zadd("idx", "a", 5);

        assertEquals(5.0, store.zscore("idx", "a").orElseThrow(), 1e-9);
        assertEquals(1, store.zcard("idx"));

        store.zrem("idx", "a");
        store.zrem("missing", "a");

        assertTrue(store.zscore("idx", "a").isEmpty());
        assertEquals(0, store.zcard("idx"));
        assertTrue(store.zrangeWithScores("missing", 10).isEmpty());
    }

    @Test
    void testIncrementScore() {
        assertEquals(1.0, store.zincrby("idx", "a", 1), 1e-9);
        assertEquals(3.0, store.zincrby("idx", "a", 2), 1e-9);
        assertEquals(3.0, store.zscore("idx", "a").orElseThrow(), 1e-9);
    }

    private static List<String> members(List<DurableStore.ScoredMember> scored) {
        return scored.stream().map(DurableStore.ScoredMember::member).toList();
    }
}
