package com.metricscache.domain.aggregation;

import com.metricscache.domain.dictionary.Dictionary;
import com.metricscache.domain.dictionary.DictionaryCodec;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.cache.CacheClient;

import java.util.List;
import java.util.Optional;

/**
 * One cache entry, fetched when the engine reaches it and decoded when a
 * dictionary is given.
 */
public class CacheEntrySource implements AggregationSource {

    private final String key;
    private final CacheClient cacheClient;
    private final DatasetPageCodec pageCodec;
    private final DictionaryCodec dictionaryCodec;
    private final Dictionary dictionary;

    public CacheEntrySource(String key, CacheClient cacheClient, DatasetPageCodec pageCodec,
                            DictionaryCodec dictionaryCodec, Dictionary dictionary) {
        this.key = key;
        this.cacheClient = cacheClient;
        this.pageCodec = pageCodec;
        this.dictionaryCodec = dictionaryCodec;
        this.dictionary = dictionary;
    }

    @Override
    public String describe() {
        return "cache entry " + key;
    }

    @Override
    public List<DatasetPage> load() {
        Optional<String> value = cacheClient.get(key);
        if (value.isEmpty()) {
            return List.of();
        }
        DatasetPage page = pageCodec.read(key, value.get());
        return List.of(dictionary != null ? dictionaryCodec.decodePage(page, dictionary) : page);
    }
}
