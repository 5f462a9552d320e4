package com.metricscache.infrastructure.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cache for computed query responses (as opposed to the dataset pages the
 * retrieval engine reads).
 *
 * Responses are stored as JSON with a TTL, so a repeated query within the TTL
 * skips fetching and aggregation entirely. Stale results up to the TTL are
 * acceptable since pages themselves are write-once per TTL window.
 *
 * Failure Handling:
 * - Circuit breaker keeps a failing Redis from blocking queries
 * - A read failure is a cache miss, a write failure is skipped
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryCacheService {

    /**
     * Namespace of every result-cache key. Page-level maintenance skips keys under it.
     */
    public static final String KEY_PREFIX = "query:";

    private final CacheClient cacheClient;
    private final ObjectMapper objectMapper;

    @CircuitBreaker(name = "redis", fallbackMethod = "getCacheFallback")
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            Optional<String> cached = cacheClient.get(key);

            if (cached.isEmpty()) {
                log.debug("Cache miss for key: {}", key);
                return Optional.empty();
            }

            T value = objectMapper.readValue(cached.get(), type);
            log.debug("Cache hit for key: {}", key);
            return Optional.of(value);

        } catch (Exception e) {
            log.error("Error reading from cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "setCacheFallback")
    public void set(String key, Object value, long ttlSeconds) {
        try {
            String json = objectMapper.writeValueAsString(value);
            cacheClient.setWithTtl(key, json, ttlSeconds);
            log.debug("Cached result for key: {} (TTL: {}s)", key, ttlSeconds);

        } catch (Exception e) {
            // A failed cache write must not fail the query
            log.error("Error writing to cache: {}", e.getMessage());
        }
    }

    public static boolean isResultKey(String key) {
        return key.startsWith(KEY_PREFIX);
    }

    /**
     * Key for a query shape: {@value #KEY_PREFIX}, the prefix, then an MD5 of the
     * parameters, so large axis lists still give a bounded key.
     */
    public String generateCacheKey(String prefix, Object... params) {
        StringBuilder shape = new StringBuilder();
        for (Object param : params) {
            shape.append('|');
            if (param instanceof Collection) {
                Collection<?> values = (Collection<?>) param;
                shape.append(values.isEmpty() ? "null" : values.stream()
                        .map(String::valueOf)
                        .collect(Collectors.joining(",")));
            } else {
                shape.append(param != null ? param.toString() : "null");
            }
        }
        return KEY_PREFIX + prefix + ":" + DigestUtils.md5DigestAsHex(shape.toString().getBytes(StandardCharsets.UTF_8));
    }

    // Fallback methods (circuit breaker)

    private <T> Optional<T> getCacheFallback(String key, Class<T> type, Exception e) {
        log.warn("Redis circuit breaker open, computing result without cache");
        return Optional.empty();
    }

    private void setCacheFallback(String key, Object value, long ttlSeconds, Exception e) {
        log.warn("Redis circuit breaker open, skipping cache write");
    }
}
