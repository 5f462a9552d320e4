package com.metricscache.domain.model;

import com.metricscache.domain.keyspace.KeyScheme;
import com.metricscache.domain.population.PopulationAxes;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Population job as submitted over the API and stored with the job.
 *
 * Either {@code axes} or {@code targetCount} must be set. Unset sizes fall back
 * to {@code metrics-cache.population.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PopulationJobRequest {

    private PopulationAxes axes;
    private KeyScheme scheme;
    private Long targetCount;
    private Integer batchSize;
    private Long ttlSeconds;
    private Integer recordsPerKey;
    private long seed;
}
