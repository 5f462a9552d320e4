package com.metricscache.config;

import com.metricscache.domain.keyspace.KeyScheme;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Typed settings for the metrics cache, bound from {@code metrics-cache.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "metrics-cache")
public class MetricsCacheProperties {

    private Population population = new Population();

    private Retrieval retrieval = new Retrieval();

    private Aggregation aggregation = new Aggregation();

    private Query query = new Query();

    private Storage storage = new Storage();

    @Data
    public static class Population {

        /**
         * Keys per pipelined SET EX round trip
         */
        private int batchSize = 1000;

        /**
         * TTL applied to every populated key (seconds)
         */
        private long ttlSeconds = 86400;

        /**
         * Records generated per key by the synthetic record factory
         */
        private int recordsPerKey = 100;

        /**
         * Number of metricValueN fields per synthetic record
         */
        private int metricValueCount = 8;

        private KeyScheme defaultScheme = KeyScheme.SHORTENED;

        /**
         * Delay between polls for pending population jobs (milliseconds)
         */
        private long pollIntervalMs = 1000;
    }

    @Data
    public static class Retrieval {

        /**
         * Default number of concurrent MGET chunks per fetch
         */
        private int concurrency = 8;

        /**
         * Worker threads shared by all fetches
         */
        private int poolSize = 16;

        /**
         * Per-chunk timeout, retries included (milliseconds)
         */
        private long chunkTimeoutMs = 10000;

        /**
         * Attempts per chunk before the fetch fails (1 = no retry)
         */
        private int maxAttempts = 3;

        private long initialBackoffMs = 100;
    }

    @Data
    public static class Aggregation {

        private int parallelism = 4;

        private int poolSize = 8;
    }

    @Data
    public static class Query {

        /**
         * TTL of cached query responses (seconds)
         */
        private long resultTtlSeconds = 300;

        /**
         * Restore absent pages from the archive table and re-warm the cache
         */
        private boolean coldStartFallback = true;

        /**
         * TTL applied when re-warming pages restored from the archive (seconds)
         */
        private long rewarmTtlSeconds = 3600;
    }

    @Data
    public static class Storage {

        /**
         * Corpus files ({@code *_records.json}) and dictionary files
         */
        private String dataDir = "data";

        /**
         * Transformed corpora and aggregation output files
         */
        private String outputDir = "output";
    }
}
