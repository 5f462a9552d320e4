package com.metricscache.domain.retrieval;

import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.dictionary.Dictionary;
import com.metricscache.domain.dictionary.DictionaryCodec;
import com.metricscache.domain.exception.PageFormatException;
import com.metricscache.domain.exception.RetrievalException;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.cache.CacheClient;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Concurrent multi-key fetch of dataset pages.
 *
 * Keys are split into at most {@code concurrency} chunks of {@code ceil(n / concurrency)}
 * keys; each chunk is one MGET, and all chunks are dispatched at once on the
 * retrieval pool. Results are joined back in the caller's key order.
 * Time a chunk spends queued behind other chunks does not count against its timeout.
 *
 * Guarantees:
 * - An absent key maps to {@code Optional.empty()} and never affects other keys
 * - Each MGET attempt has a timeout; a timed-out attempt is interrupted and retried with exponential backoff
 * - A chunk that still fails, or a value that is not a page, fails the whole
 *   call ({@link RetrievalException}); there is no partial-result mode
 */
@Slf4j
@Service
public class ParallelRetrievalEngine {

    private final CacheClient cacheClient;
    private final DatasetPageCodec pageCodec;
    private final DictionaryCodec dictionaryCodec;
    private final ExecutorService executor;
    private final MeterRegistry meterRegistry;
    private final Retry chunkRetry;
    private final long chunkTimeoutMs;

    public ParallelRetrievalEngine(CacheClient cacheClient,
                                   DatasetPageCodec pageCodec,
                                   DictionaryCodec dictionaryCodec,
                                   @Qualifier("retrievalExecutor") ExecutorService executor,
                                   MeterRegistry meterRegistry,
                                   MetricsCacheProperties properties) {
        this.cacheClient = cacheClient;
        this.pageCodec = pageCodec;
        this.dictionaryCodec = dictionaryCodec;
        this.executor = executor;
        this.meterRegistry = meterRegistry;

        MetricsCacheProperties.Retrieval retrieval = properties.getRetrieval();
        this.chunkTimeoutMs = retrieval.getChunkTimeoutMs();
        this.chunkRetry = Retry.of("retrieval-chunk", RetryConfig.custom()
                .maxAttempts(Math.max(1, retrieval.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(retrieval.getInitialBackoffMs(), 2.0))
                .ignoreExceptions(InterruptedException.class)
                .build());
    }

    public Map<String, Optional<DatasetPage>> fetchMany(List<String> keys, int concurrency) {
        return fetchMany(keys, concurrency, null);
    }

    /**
     * @param dictionary decodes every fetched page when non-null
     */
    public Map<String, Optional<DatasetPage>> fetchMany(List<String> keys, int concurrency, Dictionary dictionary) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1");
        }
        Map<String, Optional<DatasetPage>> pages = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return pages;
        }

        List<List<String>> chunks = partition(keys, concurrency);
        List<ChunkFetch> fetches = new ArrayList<>(chunks.size());
        for (List<String> chunk : chunks) {
            fetches.add(new ChunkFetch(chunk));
        }
        log.debug("Fetching {} keys in {} chunk(s)", keys.size(), chunks.size());

        long hits = 0;
        for (int i = 0; i < chunks.size(); i++) {
            List<String> chunk = chunks.get(i);
            List<String> values = await(fetches, i);
            for (int j = 0; j < chunk.size(); j++) {
                String key = chunk.get(j);
                String value = values.get(j);
                if (value == null) {
                    pages.put(key, Optional.empty());
                    continue;
                }
                DatasetPage page;
                try {
                    page = pageCodec.read(key, value);
                } catch (PageFormatException e) {
                    fetches.forEach(ChunkFetch::cancel);
                    throw new RetrievalException("Key " + key + " does not hold a dataset page", e, hits);
                }
                pages.put(key, Optional.of(dictionary != null ? dictionaryCodec.decodePage(page, dictionary) : page));
                hits++;
            }
        }

        Counter.builder("retrieval.keys").tag("result", "hit").register(meterRegistry).increment(hits);
        Counter.builder("retrieval.keys").tag("result", "miss").register(meterRegistry).increment(keys.size() - hits);
        log.debug("Fetched {} keys: {} found, {} absent", keys.size(), hits, keys.size() - hits);
        return pages;
    }

    /**
     * Pipelined existence check, one flag per key in order.
     */
    public List<Boolean> existsMany(List<String> keys) {
        if (keys.isEmpty()) {
            return List.of();
        }
        try {
            return Retry.decorateSupplier(chunkRetry, () -> cacheClient.exists(keys)).get();
        } catch (RuntimeException e) {
            throw new RetrievalException("Existence check failed for " + keys.size() + " keys", e, 0);
        }
    }

    /**
     * Checks existence first and only fetches keys that are present. Useful when
     * the key space was only partially populated.
     */
    public Map<String, Optional<DatasetPage>> fetchExisting(List<String> keys, int concurrency, Dictionary dictionary) {
        List<Boolean> flags = existsMany(keys);
        List<String> present = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            if (flags.get(i)) {
                present.add(keys.get(i));
            }
        }
        log.debug("Existence pre-check: {} of {} keys present", present.size(), keys.size());

        Map<String, Optional<DatasetPage>> fetched = fetchMany(present, concurrency, dictionary);
        Map<String, Optional<DatasetPage>> pages = new LinkedHashMap<>();
        for (String key : keys) {
            pages.put(key, fetched.getOrDefault(key, Optional.empty()));
        }
        return pages;
    }

    private List<String> await(List<ChunkFetch> fetches, int index) {
        try {
            return Retry.decorateCallable(chunkRetry, fetches.get(index)::attempt).call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fetches.forEach(ChunkFetch::cancel);
            throw new RetrievalException("Interrupted while fetching chunk " + index, e, completedKeys(fetches));
        } catch (Exception e) {
            fetches.forEach(ChunkFetch::cancel);
            long completed = completedKeys(fetches);
            log.error("Chunk {} of {} failed ({} keys completed): {}", index, fetches.size(), completed, e.toString());
            throw new RetrievalException("Retrieval chunk " + index + " failed", e, completed);
        }
    }

    private static long completedKeys(List<ChunkFetch> fetches) {
        long completed = 0;
        for (ChunkFetch fetch : fetches) {
            if (fetch.succeeded()) {
                completed += fetch.keys.size();
            }
        }
        return completed;
    }

    /**
     * One chunk's MGET attempts. The first attempt is submitted on creation so all
     * chunks run at once; retries are submitted when the caller gets to the chunk.
     */
    private final class ChunkFetch {

        private final List<String> keys;
        private Attempt current;
        private boolean consumed;

        ChunkFetch(List<String> keys) {
            this.keys = keys;
            this.current = new Attempt(keys);
        }

        List<String> attempt() throws Exception {
            if (consumed) {
                current = new Attempt(keys);
            }
            consumed = true;
            return current.await();
        }

        boolean succeeded() {
            return current.succeeded();
        }

        void cancel() {
            current.cancel();
        }
    }

    /**
     * A single MGET on the retrieval pool. Its timeout counts from the moment it
     * starts running, not from submission.
     */
    private final class Attempt {

        private final CompletableFuture<Long> started = new CompletableFuture<>();
        private final Future<List<String>> result;

        Attempt(List<String> keys) {
            this.result = executor.submit(() -> {
                started.complete(System.nanoTime());
                return cacheClient.multiGet(keys);
            });
        }

        List<String> await() throws Exception {
            long startedAt = started.get();
            long remaining = TimeUnit.MILLISECONDS.toNanos(chunkTimeoutMs) - (System.nanoTime() - startedAt);
            try {
                return result.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                result.cancel(true);
                throw e;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof Exception) {
                    throw (Exception) e.getCause();
                }
                throw e;
            }
        }

        boolean succeeded() {
            if (!result.isDone() || result.isCancelled()) {
                return false;
            }
            try {
                result.get();
                return true;
            } catch (ExecutionException e) {
                return false;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        void cancel() {
            result.cancel(true);
            // Unblocks a waiter on an attempt that never started
            started.cancel(false);
        }
    }

    static List<List<String>> partition(List<String> keys, int concurrency) {
        int chunkSize = (keys.size() + concurrency - 1) / concurrency;
        List<List<String>> chunks = new ArrayList<>();
        for (int i = 0; i < keys.size(); i += chunkSize) {
            chunks.add(keys.subList(i, Math.min(i + chunkSize, keys.size())));
        }
        return chunks;
    }
}
