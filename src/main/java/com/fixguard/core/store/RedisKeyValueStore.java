package com.fixguard.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed {@link KeyValueStore}.
 *
 * Counters use a Lua INCR + EXPIRE script (atomic), the priority index uses ZADD / ZREM / ZREVRANGE.
 * Every Spring {@link DataAccessException} is rethrown as {@link StoreUnavailableException}
 * so callers never depend on Spring Data types.
 */
@Component
@Profile("!in-memory")
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    /**
     * INCR, then EXPIRE whenever the key has no TTL. Runs atomically, so a counter can
     * never be left without expiry.
     */
    static final RedisScript<Long> INCREMENT_WITH_TTL = new DefaultRedisScript<>("""
            local value = redis.call('INCR', KEYS[1])
            if redis.call('TTL', KEYS[1]) == -1 then
                redis.call('EXPIRE', KEYS[1], ARGV[1])
            end
            return value
            """, Long.class);

    private final StringRedisTemplate redis;

    public RedisKeyValueStore(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public String get(String key) {
        return call("GET " + key, () -> redis.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SET " + key, () -> {
            if (ttl != null) redis.opsForValue().set(key, value, ttl);
            else             redis.opsForValue().set(key, value);
            return null;
        });
    }

    @Override
    public long increment(String key, Duration ttlOnCreate) {
        Long value = ttlOnCreate == null
                ? call("INCR " + key, () -> redis.opsForValue().increment(key))
                : call("INCR " + key, () -> redis.execute(INCREMENT_WITH_TTL, List.of(key),
                        String.valueOf(Math.max(1L, ttlOnCreate.getSeconds()))));
        if (value == null) {
            throw new StoreUnavailableException("INCR " + key + " returned no value");
        }
        return value;
    }

    @Override
    public void listAppend(String key, String value, Duration ttl) {
        call("RPUSH " + key, () -> redis.opsForList().rightPush(key, value));
        if (ttl != null) {
            call("EXPIRE " + key, () -> redis.expire(key, ttl));
        }
    }

    @Override
    public List<String> listRange(String key) {
        List<String> values = call("LRANGE " + key, () -> redis.opsForList().range(key, 0, -1));
        return values != null ? values : List.of();
    }

    @Override
    public void sortedSetAdd(String key, String member, double score) {
        call("ZADD " + key, () -> redis.opsForZSet().add(key, member, score));
    }

    @Override
    public List<String> sortedSetRangeDescending(String key, long start, long end) {
        Set<String> members = call("ZREVRANGE " + key,
                () -> redis.opsForZSet().reverseRange(key, start, end));
        return members != null ? new ArrayList<>(members) : List.of();
    }

    @Override
    public boolean sortedSetRemove(String key, String member) {
        Long removed = call("ZREM " + key, () -> redis.opsForZSet().remove(key, member));
        return removed != null && removed > 0;
    }

    @Override
    public boolean ping() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("[Store] Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T call(String command, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("[Store] Redis command failed: {} ({})", command, e.getMessage());
            throw new StoreUnavailableException("Redis command failed: " + command, e);
        }
    }
}
