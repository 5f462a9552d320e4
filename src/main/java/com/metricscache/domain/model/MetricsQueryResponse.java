package com.metricscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Response model for group-by queries.
 *
 * {@code groups} holds one flat object per group: group-by values followed by metric sums.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsQueryResponse {

    private List<Map<String, Object>> groups;
    private int keysRequested;
    private int keysFound;
    private int keysRestored;
    private int keysMissing;
    private long recordCount;
    private boolean cached;
    private long queryTimeMs;
}
