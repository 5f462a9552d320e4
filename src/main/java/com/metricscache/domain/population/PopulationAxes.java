package com.metricscache.domain.population;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.metricscache.domain.keyspace.CacheKeys;
import com.metricscache.domain.keyspace.DimensionalTuple;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Axes of a key-space expansion. Empty axes follow the
 * {@link CacheKeys} empty-axis policy.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PopulationAxes {

    private List<String> metricIds;
    private List<String> tenantIds;
    private List<Integer> years;
    private List<String> months;
    private List<List<String>> dimensionSets;

    @JsonIgnore
    public List<DimensionalTuple> tuples() {
        return CacheKeys.expandTuples(metricIds, tenantIds, years, months, dimensionSets);
    }
}
