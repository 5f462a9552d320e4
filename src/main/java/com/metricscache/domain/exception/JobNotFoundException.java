package com.metricscache.domain.exception;

import java.util.UUID;

public class JobNotFoundException extends MetricsCacheException {

    public JobNotFoundException(UUID jobId) {
        super("Job not found: " + jobId);
    }
}
