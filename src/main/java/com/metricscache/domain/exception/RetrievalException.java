package com.metricscache.domain.exception;

import lombok.Getter;

/**
 * A retrieval chunk failed at the transport level (after retries).
 *
 * The whole fetch fails; {@link #getCompletedKeys()} reports how many keys
 * were fetched by chunks that finished before the failure.
 */
@Getter
public class RetrievalException extends MetricsCacheException {

    private final long completedKeys;

    public RetrievalException(String message, Throwable cause, long completedKeys) {
        super(message, cause);
        this.completedKeys = completedKeys;
    }
}
