package com.metricscache.domain.exception;

import lombok.Getter;

@Getter
public class AggregationException extends MetricsCacheException {

    private final int sourcesProcessed;

    public AggregationException(String message, Throwable cause, int sourcesProcessed) {
        super(message, cause);
        this.sourcesProcessed = sourcesProcessed;
    }
}
