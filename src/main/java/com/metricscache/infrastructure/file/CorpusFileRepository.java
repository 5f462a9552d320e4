package com.metricscache.infrastructure.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.exception.MetricsCacheException;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JSON corpus files on the local file system.
 *
 * A corpus file holds a list of {@code {key, value}} page envelopes (or one bare
 * record list). Missing directories read as empty.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class CorpusFileRepository {

    public static final String RECORDS_SUFFIX = "_records.json";

    private final DatasetPageCodec pageCodec;
    private final ObjectMapper objectMapper;

    /**
     * Files in {@code directory} whose name contains {@code pattern} and ends with
     * {@code suffix}, sorted by name.
     */
    public List<Path> find(Path directory, String pattern, String suffix) {
        if (!Files.isDirectory(directory)) {
            log.warn("Corpus directory does not exist: {}", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String name = file.getFileName().toString();
                        return name.contains(pattern) && name.endsWith(suffix);
                    })
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new MetricsCacheException("Failed to list corpus directory " + directory, e);
        }
    }

    /**
     * Resolves a caller-supplied relative name under {@code baseDir}.
     *
     * @throws IllegalArgumentException when the name is absolute or escapes {@code baseDir}
     */
    public Path resolveWithin(Path baseDir, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("File name must not be blank");
        }
        Path base = baseDir.toAbsolutePath().normalize();
        Path relative = Path.of(name);
        Path resolved = base.resolve(relative).normalize();
        if (relative.isAbsolute() || !resolved.startsWith(base) || resolved.equals(base)) {
            throw new IllegalArgumentException("Path " + name + " is outside " + base);
        }
        return resolved;
    }

    public List<DatasetPage> readPages(Path file) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return pageCodec.readCorpus(file.getFileName().toString(), json);
        } catch (IOException e) {
            throw new MetricsCacheException("Failed to read corpus file " + file, e);
        }
    }

    public Path writePages(Path file, List<DatasetPage> pages) {
        return writeJson(file, pages);
    }

    public Path writeJson(Path file, Object value) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
            log.debug("Wrote {}", file);
            return file;
        } catch (IOException e) {
            throw new MetricsCacheException("Failed to write " + file, e);
        }
    }
}
