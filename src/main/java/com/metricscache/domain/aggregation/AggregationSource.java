package com.metricscache.domain.aggregation;

import com.metricscache.domain.model.DatasetPage;

import java.util.List;

/**
 * Input to the aggregation engine: an already-fetched page or a lazily read
 * file or cache entry. {@link #load()} may block on I/O; an absent source loads
 * as an empty list.
 */
public interface AggregationSource {

    String describe();

    List<DatasetPage> load();
}
