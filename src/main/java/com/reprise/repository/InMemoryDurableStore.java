package com.reprise.repository;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Heap-backed {@link DurableStore}. Counters are stored as decimal strings, as Redis does.
 */
public class InMemoryDurableStore implements DurableStore {

    private static final Comparator<ScoredMember> ASCENDING = Comparator
            .comparingDouble(ScoredMember::score)
            .thenComparing(ScoredMember::member);

    private final Map<String, byte[]> values = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, byte[] value) {
        values.put(key, value);
    }

    @Override
    public boolean delete(String key) {
        boolean removed = values.remove(key) != null;
        return sortedSets.remove(key) != null || removed;
    }

    @Override
    public Set<String> keys(String prefix) {
        return Stream.concat(values.keySet().stream(), sortedSets.keySet().stream())
                .filter(key -> key.startsWith(prefix))
                .collect(Collectors.toSet());
    }

    @Override
    public long incrBy(String key, long delta) {
        byte[] updated = values.compute(key, (k, current) -> {
            long value = current == null ? 0 : parse(current);
            return Long.toString(value + delta).getBytes(StandardCharsets.UTF_8);
        });
        return parse(updated);
    }

    @Override
    public long counter(String key) {
        byte[] current = values.get(key);
        return current == null ? 0 : parse(current);
    }

    @Override
    public void zadd(String key, String member, double score) {
        sortedSets.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).put(member, score);
    }

    @Override
    public double zincrby(String key, String member, double delta) {
        return sortedSets.computeIfAbsent(key, k -> new ConcurrentHashMap<>()).merge(member, delta, Double::sum);
    }

    @Override
    public void zrem(String key, String member) {
        Map<String, Double> set = sortedSets.get(key);
        if (set != null) {
            set.remove(member);
        }
    }

    @Override
    public Optional<Double> zscore(String key, String member) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? Optional.empty() : Optional.ofNullable(set.get(member));
    }

    @Override
    public List<ScoredMember> zrangeByScore(String key, double min, double max, int limit) {
        return members(key).stream()
                .filter(m -> m.score() >= min && m.score() <= max)
                .sorted(ASCENDING)
                .limit(limit)
                .toList();
    }

    @Override
    public List<ScoredMember> zrangeWithScores(String key, int count) {
        return members(key).stream()
                .sorted(ASCENDING)
                .limit(count)
                .toList();
    }

    @Override
    public List<ScoredMember> zrevrangeWithScores(String key, int count) {
        return members(key).stream()
                .sorted(ASCENDING.reversed())
                .limit(count)
                .toList();
    }

    @Override
    public long zcard(String key) {
        Map<String, Double> set = sortedSets.get(key);
        return set == null ? 0 : set.size();
    }

    private List<ScoredMember> members(String key) {
        Map<String, Double> set = sortedSets.get(key);
        if (set == null) {
            return List.of();
        }
        return set.entrySet().stream()
                .map(e -> new ScoredMember(e.getKey(), e.getValue()))
                .toList();
    }

    private static long parse(byte[] value) {
        return Long.parseLong(new String(value, StandardCharsets.UTF_8));
    }
}
