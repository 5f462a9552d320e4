package com.metricscache.domain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.aggregation.AggregationResult;
import com.metricscache.domain.aggregation.GroupByAggregationEngine;
import com.metricscache.domain.aggregation.PageSource;
import com.metricscache.domain.dictionary.Dictionary;
import com.metricscache.domain.dictionary.DictionaryCodec;
import com.metricscache.domain.keyspace.CacheKeys;
import com.metricscache.domain.keyspace.KeyScheme;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.domain.population.BulkPopulationEngine;
import com.metricscache.domain.population.PopulationAxes;
import com.metricscache.domain.population.PopulationRequest;
import com.metricscache.domain.population.PopulationResult;
import com.metricscache.domain.population.RecordFactory;
import com.metricscache.domain.population.SeedCorpus;
import com.metricscache.domain.population.SyntheticRecordFactory;
import com.metricscache.domain.retrieval.ParallelRetrievalEngine;
import com.metricscache.infrastructure.cache.InMemoryCacheClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Population, retrieval and aggregation wired together over one in-memory cache.
 */
class PopulateThenFetchTest {

    private InMemoryCacheClient cacheClient;
    private ExecutorService executor;
    private DatasetPageCodec pageCodec;
    private DictionaryCodec dictionaryCodec;
    private BulkPopulationEngine populationEngine;
    private ParallelRetrievalEngine retrievalEngine;
    private GroupByAggregationEngine aggregationEngine;

    @BeforeEach
    void setUp() {
        cacheClient = new InMemoryCacheClient();
        executor = Executors.newFixedThreadPool(4);
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsCacheProperties properties = new MetricsCacheProperties();
        pageCodec = new DatasetPageCodec(new ObjectMapper());
        dictionaryCodec = new DictionaryCodec();

        populationEngine = new BulkPopulationEngine(cacheClient, pageCodec, meterRegistry);
        retrievalEngine = new ParallelRetrievalEngine(cacheClient, pageCodec, dictionaryCodec, executor,
                meterRegistry, properties);
        aggregationEngine = new GroupByAggregationEngine(executor, meterRegistry, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static PopulationAxes axes(List<String> months) {
        return PopulationAxes.builder()
                .metricIds(List.of("m1"))
                .tenantIds(List.of("t1"))
                .years(List.of(2024))
                .months(months)
                .build();
    }

    @Test
    void testPopulatedPageReadableUntilTtlExpires() {
        // Given
        RecordFactory factory = target -> List.of(Map.of("region", "A", "sales", "10"));
        PopulationRequest request = PopulationRequest.builder()
                .axes(axes(List.of("01")))
                .scheme(KeyScheme.SHORTENED)
                .batchSize(100)
                .ttlSeconds(60)
                .build();

        // When
        PopulationResult result = populationEngine.populate(request, factory);

        // Then
        assertTrue(result.isSuccess());
        Map<String, Optional<DatasetPage>> before = retrievalEngine.fetchMany(List.of("m1_t1_2024_01"), 1);
        assertEquals(List.of(Map.of("region", "A", "sales", "10")), before.get("m1_t1_2024_01").orElseThrow().getRecords());

        cacheClient.advanceSeconds(59);
        assertTrue(retrievalEngine.fetchMany(List.of("m1_t1_2024_01"), 1).get("m1_t1_2024_01").isPresent());

        cacheClient.advanceSeconds(1);
        assertTrue(retrievalEngine.fetchMany(List.of("m1_t1_2024_01"), 1).get("m1_t1_2024_01").isEmpty());
    }

    @Test
    void testEncodedPopulationAggregatesLikePlain() {
        // Given
        List<String> months = List.of("01", "02", "03", "04");
        SyntheticRecordFactory synthetic = new SyntheticRecordFactory(SeedCorpus.defaults(), 20, 2, 3L);
        PopulationRequest plain = PopulationRequest.builder()
                .axes(axes(months))
                .scheme(KeyScheme.SHORTENED)
                .batchSize(3)
                .ttlSeconds(600)
                .build();
        populationEngine.populate(plain, synthetic);
        List<String> keys = CacheKeys.expandKeys(List.of("m1"), List.of("t1"), List.of(2024), months, null,
                KeyScheme.SHORTENED);

        List<DatasetPage> pages = new ArrayList<>();
        retrievalEngine.fetchMany(keys, 2).values().forEach(page -> pages.add(page.orElseThrow()));
        Dictionary dictionary = dictionaryCodec.build(pages);

        // Re-populate the same axes under the verbose scheme with encoded pages
        RecordFactory encoded = target -> dictionaryCodec.encodePage(
                new DatasetPage(target.getKey(), synthetic.create(target)), dictionary).getRecords();
        PopulationRequest verbose = PopulationRequest.builder()
                .axes(axes(months))
                .scheme(KeyScheme.VERBOSE)
                .batchSize(3)
                .ttlSeconds(600)
                .build();
        populationEngine.populate(verbose, encoded);
        List<String> verboseKeys = CacheKeys.expandKeys(List.of("m1"), List.of("t1"), List.of(2024), months, null,
                KeyScheme.VERBOSE);

        // When
        List<PageSource> plainSources = new ArrayList<>();
        pages.forEach(page -> plainSources.add(new PageSource(page)));
        List<PageSource> decodedSources = new ArrayList<>();
        retrievalEngine.fetchMany(verboseKeys, 3, dictionary).values()
                .forEach(page -> decodedSources.add(new PageSource(page.orElseThrow())));

        AggregationResult fromPlain = aggregationEngine.aggregate(plainSources,
                List.of("channel"), List.of("metricValue1", "metricValue2"));
        AggregationResult fromDecoded = aggregationEngine.aggregate(decodedSources,
                List.of("channel"), List.of("metricValue1", "metricValue2"));

        // Then
        assertEquals(fromPlain.rows(), fromDecoded.rows());
        assertEquals(80, fromDecoded.getRecordCount());
        assertTrue(fromDecoded.getCoercedValues().isEmpty());
    }
}
