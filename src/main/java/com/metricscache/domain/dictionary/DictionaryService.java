package com.metricscache.domain.dictionary;

import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.exception.DictionaryException;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.infrastructure.file.CorpusFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dictionary lifecycle over corpus files.
 *
 * Flow:
 * 1. generate: scan every {@code *_records.json} corpus file matching a pattern and persist the dictionary
 * 2. transform: write the encoded form of the matching corpus files to an output folder
 * 3. regenerate: decode previously encoded files back into an output folder
 *
 * Loaded dictionaries are kept in memory by file name; a persisted dictionary never changes.
 * File and folder names are relative to the data or output directory and may not leave it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DictionaryService {

    private final CorpusFileRepository corpusFiles;
    private final DictionaryCodec codec;
    private final DictionaryFileStore fileStore;
    private final MetricsCacheProperties properties;

    private final Map<String, Dictionary> loaded = new ConcurrentHashMap<>();

    public Path generate(String pattern, String dictionaryFile) {
        List<Path> files = matchingCorpus(dataDir(), pattern);
        log.info("Generating dictionary {} from {} file(s)", dictionaryFile, files.size());

        List<DatasetPage> corpus = new ArrayList<>();
        for (Path file : files) {
            corpus.addAll(corpusFiles.readPages(file));
        }

        Dictionary dictionary = codec.build(corpus);
        Path target = fileStore.save(dictionary, corpusFiles.resolveWithin(dataDir(), dictionaryFile));
        loaded.put(dictionaryFile, dictionary);
        return target;
    }

    public Dictionary load(String dictionaryFile) {
        return loaded.computeIfAbsent(dictionaryFile, name -> fileStore.load(corpusFiles.resolveWithin(dataDir(), name)));
    }

    /**
     * Encodes corpus files matching {@code pattern} into {@code outputDir/outputFolder},
     * keeping file names.
     */
    public List<Path> transform(String pattern, String dictionaryFile, String outputFolder) {
        Dictionary dictionary = load(dictionaryFile);
        Path target = corpusFiles.resolveWithin(outputDir(), outputFolder);

        List<Path> written = new ArrayList<>();
        for (Path file : matchingCorpus(dataDir(), pattern)) {
            List<DatasetPage> encoded = new ArrayList<>();
            for (DatasetPage page : corpusFiles.readPages(file)) {
                encoded.add(codec.encodePage(page, dictionary));
            }
            written.add(corpusFiles.writePages(target.resolve(file.getFileName()), encoded));
        }
        log.info("Transformed {} file(s) into {}", written.size(), target);
        return written;
    }

    /**
     * Decodes encoded files in {@code outputDir/inputFolder} into
     * {@code outputDir/outputFolder/regenerated_<name>}.
     */
    public List<Path> regenerate(String inputFolder, String pattern, String dictionaryFile, String outputFolder) {
        Dictionary dictionary = load(dictionaryFile);
        Path target = corpusFiles.resolveWithin(outputDir(), outputFolder);

        List<Path> written = new ArrayList<>();
        for (Path file : matchingCorpus(corpusFiles.resolveWithin(outputDir(), inputFolder), pattern)) {
            List<DatasetPage> decoded = new ArrayList<>();
            for (DatasetPage page : corpusFiles.readPages(file)) {
                decoded.add(codec.decodePage(page, dictionary));
            }
            Path out = target.resolve("regenerated_" + file.getFileName());
            written.add(corpusFiles.writePages(out, decoded));
        }
        log.info("Regenerated {} file(s) into {}", written.size(), target);
        return written;
    }

    private List<Path> matchingCorpus(Path directory, String pattern) {
        List<Path> files = corpusFiles.find(directory, pattern, CorpusFileRepository.RECORDS_SUFFIX);
        if (files.isEmpty()) {
            throw new DictionaryException("No matching files found with pattern: " + pattern + " in " + directory);
        }
        return files;
    }

    private Path dataDir() {
        return Path.of(properties.getStorage().getDataDir());
    }

    private Path outputDir() {
        return Path.of(properties.getStorage().getOutputDir());
    }
}
