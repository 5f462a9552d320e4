package com.metricscache.domain.keyspace;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Coordinates of one dataset partition.
 *
 * Any component may be null (rendered as the {@code null} sentinel in keys).
 * A null dimension list is normalized to an empty one.
 */
@Value
public class DimensionalTuple {

    String metricId;
    String tenantId;
    Integer year;
    String month;
    List<String> dimensions;

    @Builder
    public DimensionalTuple(String metricId, String tenantId, Integer year, String month, List<String> dimensions) {
        this.metricId = metricId;
        this.tenantId = tenantId;
        this.year = year;
        this.month = month;
        this.dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }
}
