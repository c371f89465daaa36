package com.reprise.repository;

import com.reprise.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed {@link DurableStore}.
 * Values go through a byte[] template; sorted sets and counters through a string template.
 */
@Slf4j
public class RedisDurableStore implements DurableStore {

    private static final String COLLABORATOR = "durable store";

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final StringRedisTemplate stringRedisTemplate;

    public RedisDurableStore(RedisTemplate<String, byte[]> redisTemplate,
                             StringRedisTemplate stringRedisTemplate) {
        this.redisTemplate = redisTemplate;
        this.stringRedisTemplate = stringRedisTemplate;
    }

    @Override
    public Optional<byte[]> get(String key) {
        return call("GET " + key, () -> Optional.ofNullable(redisTemplate.opsForValue().get(key)));
    }

    @Override
    public void set(String key, byte[] value) {
        call("SET " + key, () -> {
            redisTemplate.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL " + key, () -> Boolean.TRUE.equals(redisTemplate.delete(key)));
    }

    @Override
    public Set<String> keys(String prefix) {
        return call("KEYS " + prefix, () -> {
            Set<String> keys = redisTemplate.keys(prefix + "*");
            return keys != null ? keys : Set.of();
        });
    }

    @Override
    public long incrBy(String key, long delta) {
        return call("INCRBY " + key, () -> {
            Long value = stringRedisTemplate.opsForValue().increment(key, delta);
            return value != null ? value : 0L;
        });
    }

    @Override
    public long counter(String key) {
        return call("GET " + key, () -> {
            String value = stringRedisTemplate.opsForValue().get(key);
            return value != null ? Long.parseLong(value) : 0L;
        });
    }

    @Override
    public void zadd(String key, String member, double score) {
        call("ZADD " + key, () -> stringRedisTemplate.opsForZSet().add(key, member, score));
    }

    @Override
    public double zincrby(String key, String member, double delta) {
        Double score = call("ZINCRBY " + key, () -> stringRedisTemplate.opsForZSet().incrementScore(key, member, delta));
        return score != null ? score : delta;
    }

    @Override
    public void zrem(String key, String member) {
        call("ZREM " + key, () -> stringRedisTemplate.opsForZSet().remove(key, member));
    }

    @Override
    public Optional<Double> zscore(String key, String member) {
        return call("ZSCORE " + key, () -> Optional.ofNullable(stringRedisTemplate.opsForZSet().score(key, member)));
    }

    @Override
    public List<ScoredMember> zrangeByScore(String key, double min, double max, int limit) {
        return call("ZRANGEBYSCORE " + key, () -> toMembers(
                stringRedisTemplate.opsForZSet().rangeByScoreWithScores(key, min, max, 0, limit)));
    }

    @Override
    public List<ScoredMember> zrangeWithScores(String key, int count) {
        if (count <= 0) {
            return List.of();
        }
        return call("ZRANGE " + key, () -> toMembers(
                stringRedisTemplate.opsForZSet().rangeWithScores(key, 0, count - 1)));
    }

    @Override
    public List<ScoredMember> zrevrangeWithScores(String key, int count) {
        if (count <= 0) {
            return List.of();
        }
        return call("ZREVRANGE " + key, () -> toMembers(
                stringRedisTemplate.opsForZSet().reverseRangeWithScores(key, 0, count - 1)));
    }

    @Override
    public long zcard(String key) {
        return call("ZCARD " + key, () -> {
            Long size = stringRedisTemplate.opsForZSet().zCard(key);
            return size != null ? size : 0L;
        });
    }

    private List<ScoredMember> toMembers(Set<ZSetOperations.TypedTuple<String>> tuples) {
        if (tuples == null) {
            return List.of();
        }
        return tuples.stream()
                .filter(t -> t.getValue() != null)
                .map(t -> new ScoredMember(t.getValue(), Objects.requireNonNullElse(t.getScore(), 0.0)))
                .toList();
    }

    private <T> T call(String command, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException e) {
            log.error("Redis command failed: {}", command, e);
            throw new CollaboratorUnavailableException(COLLABORATOR, command + " failed", e);
        }
    }
}
