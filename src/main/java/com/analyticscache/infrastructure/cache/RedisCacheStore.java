package com.analyticscache.infrastructure.cache;

import com.analyticscache.exception.CacheUnavailableException;
import com.analyticscache.exception.CacheWriteException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisStringCommands.SetOption;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.core.types.Expiration;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Redis implementation of {@link CacheStore}.
 *
 * Uses the shared StringRedisTemplate created once at startup.
 *
 * Failure Handling:
 * - Circuit breaker "redis" stops hammering a dead store
 * - Every failure and every rejected call surfaces as CacheUnavailableException
 * - Pipeline command errors surface as CacheWriteException
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

    private static final RedisScript<Long> COMPARE_AND_DELETE = RedisScript.of(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then " +
            "  return redis.call('DEL', KEYS[1]) " +
            "else " +
            "  return 0 " +
            "end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "getFallback")
    public String get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "multiGetFallback")
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        return values != null ? values : Collections.nCopies(keys.size(), null);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setFallback")
    public void set(String key, String value, Duration ttl) {
        redisTemplate.opsForValue().set(key, value, ttl);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setIfAbsentFallback")
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deleteFallback")
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long removed = redisTemplate.delete(keys);
        return removed != null ? removed : 0;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "deleteIfValueEqualsFallback")
    public boolean deleteIfValueEquals(String key, String expectedValue) {
        Long removed = redisTemplate.execute(COMPARE_AND_DELETE, List.of(key), expectedValue);
        return removed != null && removed > 0;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "membersFallback")
    public Set<String> members(String setKey) {
        Set<String> members = redisTemplate.opsForSet().members(setKey);
        return members != null ? members : Collections.emptySet();
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "cardinalityFallback")
    public long cardinality(String setKey) {
        Long size = redisTemplate.opsForSet().size(setKey);
        return size != null ? size : 0;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setOperationFallback")
    public long unionStore(String destination, Collection<String> sourceKeys, Duration ttl) {
        return storeWithExpiry(destination, sourceKeys, ttl, true);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "setOperationFallback")
    public long intersectStore(String destination, Collection<String> sourceKeys, Duration ttl) {
        return storeWithExpiry(destination, sourceKeys, ttl, false);
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "ttlFallback")
    public long ttlSeconds(String key) {
        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        return ttl != null ? ttl : -2;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "ttlFallback")
    public long valueSize(String key) {
        Long size = redisTemplate.opsForValue().size(key);
        return size != null ? size : 0;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "scanFallback")
    public List<String> scan(String pattern, int count) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(count).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        return keys;
    }

    @Override
    @CircuitBreaker(name = "redis", fallbackMethod = "executeFallback")
    public void execute(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        try {
            redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
                StringRedisConnection conn = (StringRedisConnection) connection;
                for (WriteBatch.Command command : batch.commands()) {
                    switch (command.getType()) {
                        case SET -> conn.set(command.getKey(), command.getValue(),
                                Expiration.from(command.getTtl()), SetOption.upsert());
                        case SADD -> conn.sAdd(command.getKey(), command.getValue());
                        case EXPIRE -> conn.expire(command.getKey(), command.getTtl().toSeconds());
                    }
                }
                return null;
            });
        } catch (RedisConnectionFailureException e) {
            throw e;
        } catch (DataAccessException e) {
            throw new CacheWriteException("Redis pipeline failed (" + batch.commands().size() + " commands)", e);
        }
    }

    private long storeWithExpiry(String destination, Collection<String> sourceKeys, Duration ttl, boolean union) {
        String[] keys = sourceKeys.toArray(new String[0]);
        List<Object> results = redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            StringRedisConnection conn = (StringRedisConnection) connection;
            if (union) {
                conn.sUnionStore(destination, keys);
            } else {
                conn.sInterStore(destination, keys);
            }
            conn.expire(destination, ttl.toSeconds());
            return null;
        });
        Object count = results.isEmpty() ? null : results.get(0);
        return count instanceof Number ? ((Number) count).longValue() : 0;
    }

    // Fallback methods (circuit breaker)

    private String getFallback(String key, Throwable t) {
        throw unavailable("GET " + key, t);
    }

    private List<String> multiGetFallback(List<String> keys, Throwable t) {
        throw unavailable("MGET (" + keys.size() + " keys)", t);
    }

    private void setFallback(String key, String value, Duration ttl, Throwable t) {
        throw unavailable("SET " + key, t);
    }

    private boolean setIfAbsentFallback(String key, String value, Duration ttl, Throwable t) {
        throw unavailable("SET NX " + key, t);
    }

    private long deleteFallback(Collection<String> keys, Throwable t) {
        throw unavailable("DEL (" + keys.size() + " keys)", t);
    }

    private boolean deleteIfValueEqualsFallback(String key, String expectedValue, Throwable t) {
        throw unavailable("compare-and-delete " + key, t);
    }

    private Set<String> membersFallback(String setKey, Throwable t) {
        throw unavailable("SMEMBERS " + setKey, t);
    }

    private long cardinalityFallback(String setKey, Throwable t) {
        throw unavailable("SCARD " + setKey, t);
    }

    private long setOperationFallback(String destination, Collection<String> sourceKeys, Duration ttl, Throwable t) {
        throw unavailable("set operation into " + destination, t);
    }

    private long ttlFallback(String key, Throwable t) {
        throw unavailable("key inspection " + key, t);
    }

    private List<String> scanFallback(String pattern, int count, Throwable t) {
        throw unavailable("SCAN " + pattern, t);
    }

    private void executeFallback(WriteBatch batch, Throwable t) {
        if (t instanceof CacheWriteException) {
            throw (CacheWriteException) t;
        }
        throw unavailable("pipeline", t);
    }

    private CacheUnavailableException unavailable(String operation, Throwable t) {
        if (t instanceof CacheUnavailableException) {
            return (CacheUnavailableException) t;
        }
        log.warn("Redis unavailable during {}: {}", operation, t.getMessage());
        return new CacheUnavailableException("Redis unavailable during " + operation, t);
    }
}
