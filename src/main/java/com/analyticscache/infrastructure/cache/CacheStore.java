package com.analyticscache.infrastructure.cache;

import com.analyticscache.exception.CacheUnavailableException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Primitive key/value and set operations the cache is built from.
 *
 * Missing keys come back as null or empty collections. Every operation throws
 * {@link CacheUnavailableException} when the store cannot be reached, so callers
 * can tell "not found" from "store down".
 */
public interface CacheStore {

    String get(String key);

    /**
     * Values in key order, null for missing keys.
     */
    List<String> multiGet(List<String> keys);

    void set(String key, String value, Duration ttl);

    /**
     * SET NX EX. True if this call created the key.
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Number of keys that existed and were removed; missing keys are no-ops.
     */
    long delete(Collection<String> keys);

    /**
     * Deletes the key only while it still holds the expected value.
     */
    boolean deleteIfValueEquals(String key, String expectedValue);

    Set<String> members(String setKey);

    long cardinality(String setKey);

    /**
     * SUNIONSTORE into destination and give it an absolute expiry in the same round trip.
     */
    long unionStore(String destination, Collection<String> sourceKeys, Duration ttl);

    /**
     * SINTERSTORE into destination and give it an absolute expiry in the same round trip.
     */
    long intersectStore(String destination, Collection<String> sourceKeys, Duration ttl);

    /**
     * Remaining TTL in seconds; -1 without expiry, -2 when missing.
     */
    long ttlSeconds(String key);

    /**
     * Length of a string value in bytes, 0 when missing.
     */
    long valueSize(String key);

    /**
     * Cursor-based SCAN. Statistics and invalidation only, never the request path.
     */
    List<String> scan(String pattern, int count);

    /**
     * Executes all staged commands in one pipeline. Any command error fails the batch.
     */
    void execute(WriteBatch batch);
}
