package com.metricscache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Metrics Cache Backend
 *
 * Seeds a key-value cache with dimensional metrics pages and answers
 * group-by/sum queries over them.
 *
 * Architecture:
 * - Key-space addressing under three key schemes
 * - Dictionary compression of stored records
 * - Pipelined bulk population as resumable background jobs
 * - Chunked parallel MGET retrieval
 * - Group-by aggregation over pages, corpus files or cache entries
 * - Result caching and archive fallback for expired pages
 */
@SpringBootApplication
@EnableScheduling
public class MetricsCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricsCacheApplication.class, args);
    }
}
