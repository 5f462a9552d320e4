package com.metricscache.domain.aggregation;

import com.metricscache.domain.model.DatasetPage;
import com.metricscache.infrastructure.file.CorpusFileRepository;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * A corpus file, read when the engine reaches it.
 */
@Slf4j
public class FileSource implements AggregationSource {

    private final Path file;
    private final CorpusFileRepository corpusFiles;

    public FileSource(Path file, CorpusFileRepository corpusFiles) {
        this.file = file;
        this.corpusFiles = corpusFiles;
    }

    @Override
    public String describe() {
        return "file " + file;
    }

    @Override
    public List<DatasetPage> load() {
        if (!Files.exists(file)) {
            log.warn("File does not exist: {}", file);
            return List.of();
        }
        return corpusFiles.readPages(file);
    }
}
