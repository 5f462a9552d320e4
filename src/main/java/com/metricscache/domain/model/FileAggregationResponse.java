package com.metricscache.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileAggregationResponse {

    private String outputFile;
    private int filesProcessed;
    private long recordCount;
    private int groupCount;
    private long queryTimeMs;
}
