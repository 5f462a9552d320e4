package com.metricscache.domain.service;

import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.retrieval.ParallelRetrievalEngine;
import com.metricscache.infrastructure.cache.CacheClient;
import com.metricscache.infrastructure.cache.QueryCacheService;
import com.metricscache.infrastructure.persistence.entity.ArchivedPageEntity;
import com.metricscache.infrastructure.persistence.repository.ArchivedPageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-space maintenance: pattern scans, bulk delete, TTL lookup and archiving.
 *
 * Patterns use Redis glob syntax. Scans are incremental (SCAN, never KEYS).
 * {@link #scan} and {@link #deleteByPattern} see the whole key space, cached query
 * results included; {@link #scanAndGet} and {@link #archive} only see page keys.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheAdminService {

    private final CacheClient cacheClient;
    private final ParallelRetrievalEngine retrievalEngine;
    private final ArchivedPageRepository archivedPageRepository;
    private final MetricsCacheProperties properties;

    public List<String> scan(String pattern) {
        List<String> keys = cacheClient.scan(pattern);
        log.debug("Scan {} matched {} keys", pattern, keys.size());
        return keys;
    }

    /**
     * @return number of keys deleted
     */
    public long deleteByPattern(String pattern) {
        List<String> keys = cacheClient.scan(pattern);
        if (keys.isEmpty()) {
            log.info("No keys match {}", pattern);
            return 0;
        }
        long deleted = cacheClient.delete(keys);
        log.info("Deleted {} keys matching {}", deleted, pattern);
        return deleted;
    }

    /**
     * Remaining TTL in seconds; -1 for a key without expiry, -2 for an absent key.
     */
    public long ttl(String key) {
        return cacheClient.ttl(key);
    }

    /**
     * Pages of every key matching the pattern. Keys that expire between the scan
     * and the fetch are left out.
     */
    public Map<String, DatasetPage> scanAndGet(String pattern) {
        List<String> keys = pageKeys(pattern);
        Map<String, Optional<DatasetPage>> fetched = retrievalEngine.fetchMany(
                keys, properties.getRetrieval().getConcurrency());

        Map<String, DatasetPage> pages = new LinkedHashMap<>();
        fetched.forEach((key, page) -> page.ifPresent(p -> pages.put(key, p)));
        log.info("Fetched {} of {} keys matching {}", pages.size(), keys.size(), pattern);
        return pages;
    }

    /**
     * Copies the current value of every key matching the pattern into the archive
     * table, replacing earlier copies.
     *
     * @return number of pages archived
     */
    @Transactional
    public int archive(String pattern) {
        List<String> keys = pageKeys(pattern);
        if (keys.isEmpty()) {
            return 0;
        }
        List<String> values = cacheClient.multiGet(keys);

        Instant archivedAt = Instant.now();
        List<ArchivedPageEntity> entities = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            if (values.get(i) == null) {
                continue;
            }
            entities.add(ArchivedPageEntity.builder()
                    .cacheKey(keys.get(i))
                    .payload(values.get(i))
                    .archivedAt(archivedAt)
                    .build());
        }
        archivedPageRepository.saveAll(entities);
        log.info("Archived {} pages matching {}", entities.size(), pattern);
        return entities.size();
    }

    private List<String> pageKeys(String pattern) {
        List<String> keys = new ArrayList<>();
        for (String key : cacheClient.scan(pattern)) {
            if (!QueryCacheService.isResultKey(key)) {
                keys.add(key);
            }
        }
        return keys;
    }
}
