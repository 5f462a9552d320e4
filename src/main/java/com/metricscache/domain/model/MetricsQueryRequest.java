package com.metricscache.domain.model;

import com.metricscache.domain.keyspace.KeyScheme;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request model for group-by queries over cached pages.
 *
 * The key space is the cartesian product of the axes; years, months and
 * dimension sets may be left empty to address keys without them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsQueryRequest {

    @NotEmpty
    private List<String> metricIds;

    @NotEmpty
    private List<String> tenantIds;

    private List<Integer> years;
    private List<String> months;
    private List<List<String>> dimensionSets;

    @NotEmpty
    private List<String> groupBy;

    @NotEmpty
    private List<String> metrics;

    private KeyScheme scheme;

    // Decode fetched pages with this dictionary file (data directory)
    private String dictionaryFile;

    private Integer concurrency;

    // Skip keys that do not exist before fetching
    private boolean existenceCheck;

    // Bypass the result cache for this query
    private boolean skipCache;

    // Defaults
    public KeyScheme getScheme() {
        if (scheme == null) {
            return KeyScheme.SHORTENED;
        }
        return scheme;
    }

    public Integer getConcurrency() {
        if (concurrency == null || concurrency <= 0) {
            return null;
        }
        return Math.min(concurrency, 64);
    }
}
