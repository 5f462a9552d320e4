package com.metricscache.domain.population;

import java.util.List;
import java.util.Map;

/**
 * Produces the records stored under one populated key.
 */
@FunctionalInterface
public interface RecordFactory {

    List<Map<String, Object>> create(PopulationTarget target);
}
