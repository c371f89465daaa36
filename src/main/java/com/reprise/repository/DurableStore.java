package com.reprise.repository;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Key/value store with sorted sets and counters, shaped after the Redis command set.
 *
 * Implementations throw {@link com.reprise.exception.CollaboratorUnavailableException}
 * when the backing system cannot be reached.
 */
public interface DurableStore {

    Optional<byte[]> get(String key);

    void set(String key, byte[] value);

    /**
     * @return true if the key existed
     */
    boolean delete(String key);

    /**
     * All keys starting with {@code prefix}.
     */
    Set<String> keys(String prefix);

    /**
     * Add {@code delta} to the counter at {@code key}, creating it at 0 first.
     *
     * @return the new value
     */
    long incrBy(String key, long delta);

    long counter(String key);

    void zadd(String key, String member, double score);

    /**
     * Atomically add {@code delta} to a member's score, creating it at {@code delta}.
     *
     * @return the new score
     */
    double zincrby(String key, String member, double delta);

    void zrem(String key, String member);

    Optional<Double> zscore(String key, String member);

    /**
     * Members with {@code min <= score <= max}, lowest score first.
     */
    List<ScoredMember> zrangeByScore(String key, double min, double max, int limit);

    /**
     * The {@code count} lowest-scored members.
     */
    List<ScoredMember> zrangeWithScores(String key, int count);

    /**
     * The {@code count} highest-scored members.
     */
    List<ScoredMember> zrevrangeWithScores(String key, int count);

    long zcard(String key);

    record ScoredMember(String member, double score) {
    }
}
