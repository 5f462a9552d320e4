package com.metricscache.domain.aggregation;

import com.metricscache.domain.model.DatasetPage;

import java.util.List;

/**
 * A page that is already in memory.
 */
public class PageSource implements AggregationSource {

    private final DatasetPage page;

    public PageSource(DatasetPage page) {
        this.page = page;
    }

    @Override
    public String describe() {
        return "page " + page.getKey();
    }

    @Override
    public List<DatasetPage> load() {
        return List.of(page);
    }
}
