package com.metricscache.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for I/O-bound retrieval chunks and per-source aggregation tasks.
 *
 * Both pools are fixed-size; Spring calls {@code shutdown()} on context close.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ExecutorService retrievalExecutor(MetricsCacheProperties properties) {
        return Executors.newFixedThreadPool(properties.getRetrieval().getPoolSize(), namedThreads("retrieval"));
    }

    @Bean
    public ExecutorService aggregationExecutor(MetricsCacheProperties properties) {
        return Executors.newFixedThreadPool(properties.getAggregation().getPoolSize(), namedThreads("aggregation"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
