package com.metricscache.domain.aggregation;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One group-by bucket: its group-by field assignments and a running sum per metric.
 */
@Getter
public class AggregationGroup {

    private final String groupKey;
    private final Map<String, Object> fields;
    private final Map<String, Double> sums;

    public AggregationGroup(String groupKey, Map<String, Object> fields, List<String> metrics) {
        this.groupKey = groupKey;
        this.fields = new LinkedHashMap<>(fields);
        this.sums = new LinkedHashMap<>();
        for (String metric : metrics) {
            sums.put(metric, 0.0);
        }
    }

    void add(String metric, double value) {
        sums.merge(metric, value, Double::sum);
    }

    /**
     * Adds another partial group's sums into this one.
     */
    void merge(AggregationGroup other) {
        other.sums.forEach(this::add);
    }

    AggregationGroup copy() {
        AggregationGroup copy = new AggregationGroup(groupKey, fields, List.of());
        copy.sums.putAll(sums);
        return copy;
    }

    public Map<String, Double> getSums() {
        return Collections.unmodifiableMap(sums);
    }

    public Map<String, Object> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    /**
     * Flat output object: group-by values followed by metric sums.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>(fields);
        row.putAll(sums);
        return row;
    }
}
