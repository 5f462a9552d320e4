package com.metricscache.domain.aggregation;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class AggregationResult {

    /**
     * In first-seen group key order
     */
    List<AggregationGroup> groups;

    int sourceCount;

    long recordCount;

    /**
     * Metric values replaced by 0, per metric field
     */
    Map<String, Long> coercedValues;

    long elapsedMs;

    public List<Map<String, Object>> rows() {
        return groups.stream().map(AggregationGroup::toRow).collect(Collectors.toList());
    }
}
