package com.metricscache.domain.exception;

public class DictionaryException extends MetricsCacheException {

    public DictionaryException(String message) {
        super(message);
    }

    public DictionaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
