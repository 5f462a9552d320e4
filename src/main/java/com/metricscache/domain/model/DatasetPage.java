package com.metricscache.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * The value stored under one cache key: a list of flat records.
 *
 * Serialized as the {@code {key, value: [records]}} envelope used by the
 * archive and corpus files; the population path stores the bare record list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DatasetPage {

    private String key;

    @JsonProperty("value")
    private List<Map<String, Object>> records;

    public int size() {
        return records == null ? 0 : records.size();
    }
}
