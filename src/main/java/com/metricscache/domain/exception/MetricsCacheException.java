package com.metricscache.domain.exception;

/**
 * Base class for failures raised by the metrics cache core.
 */
public class MetricsCacheException extends RuntimeException {

    public MetricsCacheException(String message) {
        super(message);
    }

    public MetricsCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
