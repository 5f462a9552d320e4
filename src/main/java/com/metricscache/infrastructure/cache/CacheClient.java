package com.metricscache.infrastructure.cache;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value capabilities the core relies on. Injected into each component;
 * there is no shared client singleton.
 *
 * Transport failures surface as unchecked exceptions (Spring's
 * {@code DataAccessException} for the Redis implementation).
 */
public interface CacheClient {

    Optional<String> get(String key);

    /**
     * MGET. The result has one slot per key, in order, holding null for missing keys.
     */
    List<String> multiGet(List<String> keys);

    /**
     * Pipelined EXISTS, one flag per key in order.
     */
    List<Boolean> exists(List<String> keys);

    /**
     * Writes every entry with its TTL set atomically (SET EX), all in one pipelined round trip.
     * Entries are applied in order, so a repeated key keeps its last value.
     */
    void setAllWithTtl(List<Map.Entry<String, String>> entries, long ttlSeconds);

    default void setWithTtl(String key, String value, long ttlSeconds) {
        setAllWithTtl(List.of(Map.entry(key, value)), ttlSeconds);
    }

    /**
     * Remaining time to live in seconds; -1 when the key never expires, -2 when it is absent.
     */
    long ttl(String key);

    List<String> scan(String pattern);

    long delete(Collection<String> keys);
}
