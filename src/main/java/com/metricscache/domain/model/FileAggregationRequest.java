package com.metricscache.domain.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregates the {@code *_records.json} corpus files whose name contains {@code pattern}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileAggregationRequest {

    @NotBlank
    private String pattern;

    @NotEmpty
    private List<String> groupBy;

    @NotEmpty
    private List<String> metrics;

    private String outputName;

    @Builder.Default
    private boolean timestamped = true;

    public String getOutputName() {
        if (outputName == null || outputName.isBlank()) {
            return "aggregated_" + pattern;
        }
        return outputName;
    }
}
