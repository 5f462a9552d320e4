package com.metricscache.domain.population;

import com.metricscache.domain.keyspace.CacheKeys;
import com.metricscache.domain.keyspace.DimensionalTuple;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.cache.CacheClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.LongConsumer;

/**
 * Seeds the cache with generated dataset pages.
 *
 * Processing Flow:
 * 1. Build the target sequence (axis expansion or synthetic volume), skipping {@code offset} targets
 * 2. Fill a batch of {@code batchSize} targets, generating each page with the record factory
 * 3. Write the batch as pipelined SET EX commands (one round trip)
 * 4. Report progress, then continue with the next batch
 *
 * Failure Handling:
 * - A failed batch aborts the run; earlier batches stay written, the failed one is not retried
 * - The result carries the written count and the offset to resume from
 * - Interruption is honoured between batches
 *
 * Every key carries the request TTL. Concurrent writers to the same key race
 * under last-write-wins; keys are write-once per TTL window in normal use.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkPopulationEngine {

    private final CacheClient cacheClient;
    private final DatasetPageCodec pageCodec;
    private final MeterRegistry meterRegistry;

    public PopulationResult populate(PopulationRequest request, RecordFactory recordFactory) {
        return populate(request, recordFactory, written -> { });
    }

    /**
     * @param progress receives the total written so far (offset included) after every batch
     */
    public PopulationResult populate(PopulationRequest request, RecordFactory recordFactory, LongConsumer progress) {
        if (request.getTtlSeconds() <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, permanent keys are never written");
        }
        if (request.getBatchSize() <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        if (request.getOffset() < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }

        long startTime = System.currentTimeMillis();
        long offset = request.getOffset();
        long written = 0;
        Iterator<PopulationTarget> targets = targets(request);

        log.info("Starting population: mode={}, batchSize={}, ttl={}s, offset={}",
                request.isVolumeMode() ? "volume" : "axes", request.getBatchSize(), request.getTtlSeconds(), offset);

        while (targets.hasNext()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Population interrupted after {} keys", offset + written);
                return result(written, offset, startTime, PopulationStatus.INTERRUPTED, "Interrupted between batches");
            }

            int batchSize = 0;
            try {
                List<Map.Entry<String, String>> batch = new ArrayList<>(request.getBatchSize());
                while (batch.size() < request.getBatchSize() && targets.hasNext()) {
                    PopulationTarget target = targets.next();
                    batch.add(Map.entry(target.getKey(), pageCodec.writeRecords(recordFactory.create(target))));
                }
                batchSize = batch.size();

                cacheClient.setAllWithTtl(batch, request.getTtlSeconds());

            } catch (RuntimeException e) {
                log.error("Batch of {} keys failed after {} keys written, aborting: {}",
                        batchSize, offset + written, e.getMessage(), e);
                Counter.builder("population.batches")
                        .tag("result", "error")
                        .register(meterRegistry)
                        .increment();
                return result(written, offset, startTime, PopulationStatus.FAILED, e.getMessage());
            }

            written += batchSize;
            Counter.builder("population.batches")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();
            log.info("Inserted {} keys so far...", offset + written);
            progress.accept(offset + written);
        }

        PopulationResult result = result(written, offset, startTime, PopulationStatus.COMPLETED, null);
        log.info("Population completed: {}", result);
        return result;
    }

    private Iterator<PopulationTarget> targets(PopulationRequest request) {
        long offset = request.getOffset();

        if (request.isVolumeMode()) {
            SyntheticKeyFactory keys = request.getVolumeKeys() != null
                    ? request.getVolumeKeys()
                    : SyntheticKeyFactory.defaults(0L);
            long targetCount = request.getTargetCount();
            return new Iterator<>() {
                private long index = offset;

                @Override
                public boolean hasNext() {
                    return index < targetCount;
                }

                @Override
                public PopulationTarget next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    long current = index++;
                    return new PopulationTarget(keys.keyFor(current), null, current);
                }
            };
        }

        if (request.getAxes() == null) {
            throw new IllegalArgumentException("Population needs either axes or a target count");
        }
        List<DimensionalTuple> tuples = request.getAxes().tuples();
        return new Iterator<>() {
            private long index = offset;

            @Override
            public boolean hasNext() {
                return index < tuples.size();
            }

            @Override
            public PopulationTarget next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                DimensionalTuple tuple = tuples.get((int) index);
                return new PopulationTarget(CacheKeys.buildKey(tuple, request.getScheme()), tuple, index++);
            }
        };
    }

    private static PopulationResult result(long written, long offset, long startTime,
                                           PopulationStatus status, String errorMessage) {
        return PopulationResult.builder()
                .written(written)
                .nextOffset(offset + written)
                .elapsedMs(System.currentTimeMillis() - startTime)
                .status(status)
                .errorMessage(errorMessage)
                .build();
    }
}
