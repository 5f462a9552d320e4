package com.metricscache.domain.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.dictionary.DictionaryCodec;
import com.metricscache.domain.exception.AggregationException;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.cache.InMemoryCacheClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class GroupByAggregationEngineTest {

    private ExecutorService executor;
    private MeterRegistry meterRegistry;
    private GroupByAggregationEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        meterRegistry = new SimpleMeterRegistry();
        engine = new GroupByAggregationEngine(executor, meterRegistry, new MetricsCacheProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Map<String, Object> record(Object... fields) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < fields.length; i += 2) {
            record.put((String) fields[i], fields[i + 1]);
        }
        return record;
    }

    @SafeVarargs
    private static PageSource page(String key, Map<String, Object>... records) {
        return new PageSource(new DatasetPage(key, List.of(records)));
    }

    @Test
    void testAggregate_SumsPerGroupAndCoercesMalformedValues() {
        // Given
        List<PageSource> sources = List.of(page("k1",
                record("region", "A", "sales", "10"),
                record("region", "A", "sales", "5"),
                record("region", "B", "sales", "x")));

        // When
        AggregationResult result = engine.aggregate(sources, List.of("region"), List.of("sales"));

        // Then
        assertEquals(List.of(
                record("region", "A", "sales", 15.0),
                record("region", "B", "sales", 0.0)), result.rows());
        assertEquals(3, result.getRecordCount());
        assertEquals(Map.of("sales", 1L), result.getCoercedValues());
        assertEquals(3.0, meterRegistry.counter("aggregation.records").count());
    }

    @Test
    void testAggregate_ZeroSources() {
        AggregationResult result = engine.aggregate(List.of(), List.of("region"), List.of("sales"));

        assertTrue(result.rows().isEmpty());
        assertEquals(0, result.getSourceCount());
    }

    @Test
    void testAggregate_MissingGroupFieldBecomesUnknown() {
        AggregationResult result = engine.aggregate(
                List.of(page("k1", record("region", "A", "sales", 1), record("sales", 2))),
                List.of("region"), List.of("sales"));

        AggregationGroup unknown = result.getGroups().get(1);
        assertEquals("Unknown region", unknown.getGroupKey());
        assertEquals("Unknown region", unknown.getFields().get("region"));
        assertEquals(2.0, unknown.getSums().get("sales"));
    }

    @Test
    void testAggregate_CompositeGroupKey() {
        AggregationResult result = engine.aggregate(
                List.of(page("k1",
                        record("channel", "Search", "platform", "Google", "clicks", 3),
                        record("channel", "Search", "platform", "Bing", "clicks", 4),
                        record("channel", "Search", "platform", "Google", "clicks", 5.5))),
                List.of("channel", "platform"), List.of("clicks"));

        assertEquals(2, result.getGroups().size());
        assertEquals("Search|Google", result.getGroups().get(0).getGroupKey());
        assertEquals(8.5, result.getGroups().get(0).getSums().get("clicks"));
    }

    @Test
    void testAggregate_NonNumericKindsContributeZero() {
        Map<String, Object> nullMetric = new HashMap<>();
        nullMetric.put("region", "A");
        nullMetric.put("sales", null);

        AggregationResult result = engine.aggregate(
                List.of(page("k1",
                        record("region", "A", "sales", true),
                        record("region", "A", "sales", "NaN"),
                        record("region", "A"),
                        nullMetric,
                        record("region", "A", "sales", " 2.5 "))),
                List.of("region"), List.of("sales"));

        assertEquals(2.5, result.getGroups().get(0).getSums().get("sales"));
        assertEquals(4L, result.getCoercedValues().get("sales"));
    }

    @Test
    void testAggregate_ParallelMatchesSequentialForAnySourceOrder() {
        // Given
        List<PageSource> sources = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            sources.add(page("k" + i,
                    record("region", "R" + (i % 3), "sales", i, "clicks", "1"),
                    record("region", "R" + (i % 5), "sales", 2 * i, "clicks", "2")));
        }
        List<PageSource> shuffled = new ArrayList<>(sources);
        Collections.shuffle(shuffled, new Random(7));

        // When
        AggregationResult sequential = engine.aggregate(sources, List.of("region"), List.of("sales", "clicks"), 1);
        AggregationResult parallel = engine.aggregate(shuffled, List.of("region"), List.of("sales", "clicks"), 4);

        // Then
        assertEquals(sums(sequential), sums(parallel));
        assertEquals(sequential.getRecordCount(), parallel.getRecordCount());
    }

    @Test
    void testAggregate_ParallelKeepsFirstSeenOrder() {
        List<PageSource> sources = List.of(
                page("k1", record("region", "B", "sales", 1)),
                page("k2", record("region", "A", "sales", 1)),
                page("k3", record("region", "C", "sales", 1)),
                page("k4", record("region", "A", "sales", 1)));

        AggregationResult result = engine.aggregate(sources, List.of("region"), List.of("sales"), 3);

        assertEquals(List.of("B", "A", "C"),
                List.of(result.getGroups().get(0).getGroupKey(),
                        result.getGroups().get(1).getGroupKey(),
                        result.getGroups().get(2).getGroupKey()));
        assertEquals(2.0, result.getGroups().get(1).getSums().get("sales"));
    }

    @Test
    void testAggregate_CacheEntrySources() {
        InMemoryCacheClient cacheClient = new InMemoryCacheClient();
        cacheClient.put("m1_t1_2024_01", "[{\"region\":\"A\",\"sales\":\"4\"}]");
        DatasetPageCodec pageCodec = new DatasetPageCodec(new ObjectMapper());
        DictionaryCodec dictionaryCodec = new DictionaryCodec();

        AggregationResult result = engine.aggregate(List.of(
                        new CacheEntrySource("m1_t1_2024_01", cacheClient, pageCodec, dictionaryCodec, null),
                        new CacheEntrySource("m1_t1_2024_02", cacheClient, pageCodec, dictionaryCodec, null)),
                List.of("region"), List.of("sales"));

        assertEquals(List.of(record("region", "A", "sales", 4.0)), result.rows());
        assertEquals(2, result.getSourceCount());
    }

    @Test
    void testAggregate_SourceFailureReportsProgress() {
        AggregationSource broken = new AggregationSource() {
            @Override
            public String describe() {
                return "broken";
            }

            @Override
            public List<DatasetPage> load() {
                throw new IllegalStateException("disk gone");
            }
        };

        AggregationException e = assertThrows(AggregationException.class, () -> engine.aggregate(
                List.of(page("k1", record("region", "A", "sales", 1)), broken),
                List.of("region"), List.of("sales"), 1));

        assertEquals(1, e.getSourcesProcessed());
    }

    @Test
    void testAggregate_InterruptedBeforeFirstSource() {
        Thread.currentThread().interrupt();
        try {
            AggregationException e = assertThrows(AggregationException.class, () -> engine.aggregate(
                    List.of(page("k1", record("region", "A", "sales", 1))),
                    List.of("region"), List.of("sales"), 1));

            assertEquals(0, e.getSourcesProcessed());
        } finally {
            Thread.interrupted();
        }
    }

    private static Map<String, Map<String, Double>> sums(AggregationResult result) {
        Map<String, Map<String, Double>> sums = new HashMap<>();
        for (AggregationGroup group : result.getGroups()) {
            sums.put(group.getGroupKey(), group.getSums());
        }
        return sums;
    }
}
