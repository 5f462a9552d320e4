package com.metricscache.domain.service;

import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.aggregation.AggregationOutputWriter;
import com.metricscache.domain.aggregation.AggregationResult;
import com.metricscache.domain.aggregation.AggregationSource;
import com.metricscache.domain.aggregation.FileSource;
import com.metricscache.domain.aggregation.GroupByAggregationEngine;
import com.metricscache.domain.aggregation.PageSource;
import com.metricscache.domain.dictionary.Dictionary;
import com.metricscache.domain.dictionary.DictionaryCodec;
import com.metricscache.domain.dictionary.DictionaryService;
import com.metricscache.domain.exception.MetricsCacheException;
import com.metricscache.domain.keyspace.CacheKeys;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.domain.model.FileAggregationRequest;
import com.metricscache.domain.model.FileAggregationResponse;
import com.metricscache.domain.model.MetricsQueryRequest;
import com.metricscache.domain.model.MetricsQueryResponse;
import com.metricscache.domain.retrieval.ParallelRetrievalEngine;
import com.metricscache.infrastructure.cache.CacheClient;
import com.metricscache.infrastructure.cache.QueryCacheService;
import com.metricscache.infrastructure.file.CorpusFileRepository;
import com.metricscache.infrastructure.persistence.entity.ArchivedPageEntity;
import com.metricscache.infrastructure.persistence.repository.ArchivedPageRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Query service for cached metrics.
 *
 * Query Flow:
 * 1. Generate result-cache key from the query shape and check the result cache
 * 2. Expand the axes into page keys
 * 3. Fetch pages in parallel (optionally after an existence pre-check), decoding with the dictionary
 * 4. Restore absent pages from the archive table and re-warm the cache
 * 5. Group and sum
 * 6. Store the response in the result cache
 *
 * Caching Strategy:
 * - Responses are cached for {@code metrics-cache.query.result-ttl-seconds}
 * - Restored pages are re-cached for {@code metrics-cache.query.rewarm-ttl-seconds}
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsQueryService {

    private final ParallelRetrievalEngine retrievalEngine;
    private final GroupByAggregationEngine aggregationEngine;
    private final AggregationOutputWriter outputWriter;
    private final DictionaryService dictionaryService;
    private final DictionaryCodec dictionaryCodec;
    private final DatasetPageCodec pageCodec;
    private final CacheClient cacheClient;
    private final QueryCacheService cacheService;
    private final ArchivedPageRepository archivedPageRepository;
    private final CorpusFileRepository corpusFiles;
    private final MetricsCacheProperties properties;
    private final MeterRegistry meterRegistry;

    public MetricsQueryResponse query(MetricsQueryRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            String cacheKey = cacheService.generateCacheKey(
                    "metrics",
                    request.getMetricIds(),
                    request.getTenantIds(),
                    request.getYears(),
                    request.getMonths(),
                    request.getDimensionSets(),
                    request.getGroupBy(),
                    request.getMetrics(),
                    request.getScheme(),
                    request.getDictionaryFile()
            );

            if (!request.isSkipCache()) {
                Optional<MetricsQueryResponse> cached = cacheService.get(cacheKey, MetricsQueryResponse.class);

                if (cached.isPresent()) {
                    log.debug("Cache hit for query: {}", cacheKey);

                    Counter.builder("query.cache")
                            .tag("result", "hit")
                            .register(meterRegistry)
                            .increment();

                    MetricsQueryResponse response = cached.get();
                    response.setCached(true);
                    return response;
                }
            }

            log.debug("Cache miss for query: {}", cacheKey);

            Counter.builder("query.cache")
                    .tag("result", "miss")
                    .register(meterRegistry)
                    .increment();

            long startTime = System.currentTimeMillis();

            List<String> keys = CacheKeys.expandKeys(
                    request.getMetricIds(),
                    request.getTenantIds(),
                    request.getYears(),
                    request.getMonths(),
                    request.getDimensionSets(),
                    request.getScheme()
            );
            Dictionary dictionary = request.getDictionaryFile() != null
                    ? dictionaryService.load(request.getDictionaryFile())
                    : null;
            int concurrency = request.getConcurrency() != null
                    ? request.getConcurrency()
                    : properties.getRetrieval().getConcurrency();

            Map<String, Optional<DatasetPage>> pages = request.isExistenceCheck()
                    ? retrievalEngine.fetchExisting(keys, concurrency, dictionary)
                    : retrievalEngine.fetchMany(keys, concurrency, dictionary);

            // Expansion keeps duplicate keys; counts are over distinct keys
            int requested = pages.size();
            List<String> missing = new ArrayList<>();
            pages.forEach((key, page) -> {
                if (page.isEmpty()) {
                    missing.add(key);
                }
            });
            int found = requested - missing.size();

            int restored = 0;
            if (!missing.isEmpty() && properties.getQuery().isColdStartFallback()) {
                restored = restoreFromArchive(missing, pages, dictionary);
            }

            List<AggregationSource> sources = new ArrayList<>();
            for (Optional<DatasetPage> page : pages.values()) {
                page.ifPresent(p -> sources.add(new PageSource(p)));
            }
            AggregationResult result = aggregationEngine.aggregate(sources, request.getGroupBy(), request.getMetrics());

            long queryTime = System.currentTimeMillis() - startTime;

            MetricsQueryResponse response = MetricsQueryResponse.builder()
                    .groups(result.rows())
                    .keysRequested(requested)
                    .keysFound(found)
                    .keysRestored(restored)
                    .keysMissing(missing.size() - restored)
                    .recordCount(result.getRecordCount())
                    .cached(false)
                    .queryTimeMs(queryTime)
                    .build();

            cacheService.set(cacheKey, response, properties.getQuery().getResultTtlSeconds());

            sample.stop(Timer.builder("query.latency")
                    .tag("type", "metrics")
                    .tag("cached", "false")
                    .register(meterRegistry));

            log.info("Query executed: {} keys ({} found, {} restored), {} groups, {} ms",
                    requested, found, restored, response.getGroups().size(), queryTime);

            return response;

        } catch (RuntimeException e) {
            log.error("Error executing query: {}", e.getMessage(), e);

            Counter.builder("query.executed")
                    .tag("type", "metrics")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            if (e instanceof MetricsCacheException || e instanceof IllegalArgumentException) {
                throw e;
            }
            throw new MetricsCacheException("Query execution failed", e);
        }
    }

    /**
     * Aggregates corpus files from the data directory and writes the groups to
     * the output directory.
     */
    public FileAggregationResponse aggregateFiles(FileAggregationRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        List<Path> files = corpusFiles.find(
                Path.of(properties.getStorage().getDataDir()),
                request.getPattern(),
                CorpusFileRepository.RECORDS_SUFFIX);
        if (files.isEmpty()) {
            log.warn("No corpus files match pattern: {}", request.getPattern());
        }

        List<AggregationSource> sources = new ArrayList<>(files.size());
        for (Path file : files) {
            sources.add(new FileSource(file, corpusFiles));
        }
        AggregationResult result = aggregationEngine.aggregate(sources, request.getGroupBy(), request.getMetrics());

        Path output = outputWriter.write(result,
                Path.of(properties.getStorage().getOutputDir()),
                request.getOutputName(),
                request.isTimestamped());

        sample.stop(Timer.builder("query.latency")
                .tag("type", "files")
                .tag("cached", "false")
                .register(meterRegistry));

        return FileAggregationResponse.builder()
                .outputFile(output.toString())
                .filesProcessed(files.size())
                .recordCount(result.getRecordCount())
                .groupCount(result.getGroups().size())
                .queryTimeMs(System.currentTimeMillis() - startTime)
                .build();
    }

    /**
     * Fills absent pages from the archive table and writes them back to the cache.
     *
     * @return number of pages restored
     */
    private int restoreFromArchive(List<String> missing, Map<String, Optional<DatasetPage>> pages, Dictionary dictionary) {
        List<ArchivedPageEntity> archived = archivedPageRepository.findByCacheKeyIn(missing);
        if (archived.isEmpty()) {
            return 0;
        }

        List<Map.Entry<String, String>> rewarm = new ArrayList<>(archived.size());
        for (ArchivedPageEntity entity : archived) {
            DatasetPage page = pageCodec.read(entity.getCacheKey(), entity.getPayload());
            pages.put(entity.getCacheKey(), Optional.of(dictionary != null
                    ? dictionaryCodec.decodePage(page, dictionary)
                    : page));
            rewarm.add(Map.entry(entity.getCacheKey(), entity.getPayload()));
        }

        try {
            cacheClient.setAllWithTtl(rewarm, properties.getQuery().getRewarmTtlSeconds());
            log.info("Restored {} page(s) from archive and re-warmed the cache", archived.size());
        } catch (RuntimeException e) {
            // Not fatal: this query already has the pages
            log.warn("Restored {} page(s) from archive but could not re-warm the cache: {}",
                    archived.size(), e.getMessage());
        }
        return archived.size();
    }
}
