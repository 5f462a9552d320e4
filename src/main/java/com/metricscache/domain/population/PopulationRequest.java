package com.metricscache.domain.population;

import com.metricscache.domain.keyspace.KeyScheme;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What to populate. Either {@code axes} (expanded under {@code scheme}) or a
 * synthetic {@code targetCount} with keys from {@code volumeKeys}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PopulationRequest {

    private PopulationAxes axes;

    @Builder.Default
    private KeyScheme scheme = KeyScheme.SHORTENED;

    private Long targetCount;

    private SyntheticKeyFactory volumeKeys;

    private int batchSize;

    private long ttlSeconds;

    /**
     * Targets to skip, as reported by a previous run's {@code nextOffset}
     */
    private long offset;

    public boolean isVolumeMode() {
        return targetCount != null;
    }
}
