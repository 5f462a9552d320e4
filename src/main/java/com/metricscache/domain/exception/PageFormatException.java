package com.metricscache.domain.exception;

/**
 * A stored value could not be read as a dataset page.
 */
public class PageFormatException extends MetricsCacheException {

    public PageFormatException(String message) {
        super(message);
    }

    public PageFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
