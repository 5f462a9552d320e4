package com.metricscache.infrastructure.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * {@link CacheClient} over Spring Data Redis (Lettuce driver).
 *
 * Batched writes and existence checks use {@code executePipelined}, so a batch
 * costs one network round trip regardless of its size. Writes are SET EX, so a
 * key never exists without its TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheClient implements CacheClient {

    private static final long SCAN_COUNT = 100;

    private final RedisTemplate<String, String> redisTemplate;

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    }

    @Override
    public List<String> multiGet(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<String> values = redisTemplate.opsForValue().multiGet(keys);
        if (values == null || values.size() != keys.size()) {
            throw new IllegalStateException("MGET returned " + (values == null ? "no reply" : values.size() + " values")
                    + " for " + keys.size() + " keys");
        }
        return values;
    }

    @Override
    public List<Boolean> exists(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        List<Object> replies = pipelined(ops -> {
            for (String key : keys) {
                ops.hasKey(key);
            }
        });
        List<Boolean> flags = new ArrayList<>(replies.size());
        for (Object reply : replies) {
            flags.add(Boolean.TRUE.equals(reply));
        }
        return flags;
    }

    @Override
    public void setAllWithTtl(List<Map.Entry<String, String>> entries, long ttlSeconds) {
        if (entries.isEmpty()) {
            return;
        }
        pipelined(ops -> {
            for (Map.Entry<String, String> entry : entries) {
                ops.opsForValue().set(entry.getKey(), entry.getValue(), ttlSeconds, TimeUnit.SECONDS);
            }
        });
        log.debug("Pipelined {} SET EX writes (TTL: {}s)", entries.size(), ttlSeconds);
    }

    @Override
    public long ttl(String key) {
        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        return ttl == null ? -2 : ttl;
    }

    @Override
    public List<String> scan(String pattern) {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_COUNT).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        }
        log.debug("Found {} keys matching pattern \"{}\"", keys.size(), pattern);
        return keys;
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = redisTemplate.delete(keys);
        return deleted == null ? 0 : deleted;
    }

    /**
     * Runs the commands on one pipelined connection and returns their replies in order.
     */
    private List<Object> pipelined(Consumer<RedisOperations<String, String>> commands) {
        return redisTemplate.executePipelined(new SessionCallback<Object>() {
            @Override
            public <K, V> Object execute(RedisOperations<K, V> operations) throws DataAccessException {
                // operations is redisTemplate itself, bound to the pipelined connection
                commands.accept(redisTemplate);
                return null;
            }
        });
    }
}
