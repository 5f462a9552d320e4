package com.metricscache.domain.aggregation;

import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.exception.AggregationException;
import com.metricscache.domain.model.DatasetPage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Equality group-by with summed metrics over pages, files or cache entries.
 *
 * Processing Flow:
 * 1. Split the sources into at most {@code parallelism} contiguous buckets
 * 2. Each bucket loads its sources one by one into a partial group map
 * 3. Partial maps are merged in bucket order, so groups keep first-seen order
 *
 * Group keys join the group-by values with {@code |}; a missing or null field
 * becomes {@code "Unknown <field>"}. Metric values that are missing, null,
 * boolean, non-numeric or non-finite add 0 and are counted per field.
 */
@Slf4j
@Service
public class GroupByAggregationEngine {

    static final String SEPARATOR = "|";

    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final int defaultParallelism;

    public GroupByAggregationEngine(@Qualifier("aggregationExecutor") ExecutorService executor,
                                    MeterRegistry meterRegistry,
                                    MetricsCacheProperties properties) {
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.defaultParallelism = properties.getAggregation().getParallelism();
    }

    public AggregationResult aggregate(List<? extends AggregationSource> sources,
                                       List<String> groupBy,
                                       List<String> metrics) {
        return aggregate(sources, groupBy, metrics, defaultParallelism);
    }

    public AggregationResult aggregate(List<? extends AggregationSource> sources,
                                       List<String> groupBy,
                                       List<String> metrics,
                                       int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
        long startTime = System.currentTimeMillis();
        AtomicInteger processed = new AtomicInteger();

        Partial total;
        if (parallelism == 1 || sources.size() <= 1) {
            total = process(sources, groupBy, metrics, processed);
        } else {
            total = processParallel(sources, groupBy, metrics, parallelism, processed);
        }

        if (!total.coerced.isEmpty()) {
            log.warn("Non-numeric metric values counted as 0: {}", total.coerced);
        }
        Counter.builder("aggregation.records")
                .register(meterRegistry)
                .increment(total.records);

        AggregationResult result = AggregationResult.builder()
                .groups(new ArrayList<>(total.groups.values()))
                .sourceCount(sources.size())
                .recordCount(total.records)
                .coercedValues(total.coerced)
                .elapsedMs(System.currentTimeMillis() - startTime)
                .build();
        log.info("Aggregated {} records from {} source(s) into {} groups in {}ms",
                result.getRecordCount(), result.getSourceCount(), result.getGroups().size(), result.getElapsedMs());
        return result;
    }

    private Partial processParallel(List<? extends AggregationSource> sources, List<String> groupBy,
                                    List<String> metrics, int parallelism, AtomicInteger processed) {
        int bucketSize = (sources.size() + parallelism - 1) / parallelism;
        List<CompletableFuture<Partial>> futures = new ArrayList<>();
        for (int i = 0; i < sources.size(); i += bucketSize) {
            List<? extends AggregationSource> bucket = sources.subList(i, Math.min(i + bucketSize, sources.size()));
            futures.add(CompletableFuture.supplyAsync(() -> process(bucket, groupBy, metrics, processed), executor));
        }

        Partial total = new Partial();
        for (CompletableFuture<Partial> future : futures) {
            try {
                total.merge(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.forEach(f -> f.cancel(true));
                throw new AggregationException("Aggregation interrupted", e, processed.get());
            } catch (ExecutionException e) {
                futures.forEach(f -> f.cancel(true));
                Throwable cause = e.getCause();
                if (cause instanceof AggregationException) {
                    throw (AggregationException) cause;
                }
                throw new AggregationException("Aggregation failed: " + cause.getMessage(), cause, processed.get());
            }
        }
        return total;
    }

    private Partial process(List<? extends AggregationSource> sources, List<String> groupBy,
                            List<String> metrics, AtomicInteger processed) {
        Partial partial = new Partial();
        for (AggregationSource source : sources) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AggregationException("Aggregation interrupted before " + source.describe(),
                        null, processed.get());
            }
            List<DatasetPage> pages;
            try {
                pages = source.load();
            } catch (RuntimeException e) {
                log.error("Failed to load {}: {}", source.describe(), e.getMessage(), e);
                throw new AggregationException("Failed to load " + source.describe(), e, processed.get());
            }
            for (DatasetPage page : pages) {
                if (page.getRecords() == null) {
                    continue;
                }
                for (Map<String, Object> record : page.getRecords()) {
                    partial.add(record, groupBy, metrics);
                }
            }
            processed.incrementAndGet();
            log.debug("Aggregated {}", source.describe());
        }
        return partial;
    }

    static String groupKey(Map<String, Object> record, List<String> groupBy, Map<String, Object> fields) {
        List<String> labels = new ArrayList<>(groupBy.size());
        for (String field : groupBy) {
            Object value = record.get(field);
            String label = value != null ? String.valueOf(value) : "Unknown " + field;
            fields.put(field, value != null ? value : label);
            labels.add(label);
        }
        return String.join(SEPARATOR, labels);
    }

    /**
     * @return the metric value, or {@code null} when it has to be coerced to 0
     */
    static Double metricValue(Object raw) {
        double value;
        if (raw instanceof Number) {
            value = ((Number) raw).doubleValue();
        } else if (raw instanceof String) {
            try {
                value = Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    /**
     * Group map and counters for one bucket of sources.
     */
    private static final class Partial {

        private final Map<String, AggregationGroup> groups = new LinkedHashMap<>();
        private final Map<String, Long> coerced = new LinkedHashMap<>();
        private long records;

        void add(Map<String, Object> record, List<String> groupBy, List<String> metrics) {
            Map<String, Object> fields = new LinkedHashMap<>();
            String key = groupKey(record, groupBy, fields);
            AggregationGroup group = groups.computeIfAbsent(key, k -> new AggregationGroup(k, fields, metrics));
            for (String metric : metrics) {
                Double value = metricValue(record.get(metric));
                if (value == null) {
                    coerced.merge(metric, 1L, Long::sum);
                    value = 0.0;
                }
                group.add(metric, value);
            }
            records++;
        }

        void merge(Partial other) {
            other.groups.forEach((key, group) -> {
                AggregationGroup existing = groups.get(key);
                if (existing == null) {
                    groups.put(key, group.copy());
                } else {
                    existing.merge(group);
                }
            });
            other.coerced.forEach((metric, count) -> coerced.merge(metric, count, Long::sum));
            records += other.records;
        }
    }
}
