package com.metricscache.domain.population;

import com.metricscache.domain.keyspace.DimensionalTuple;
import lombok.Value;

/**
 * One key to write. {@code tuple} is null for synthetic-volume targets;
 * {@code index} is the target's position in the full run (offset included).
 */
@Value
public class PopulationTarget {

    String key;
    DimensionalTuple tuple;
    long index;
}
