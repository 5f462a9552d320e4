package com.metricscache.domain.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.exception.DictionaryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Persists dictionaries as {@code {"keys": {...}, "values": {...}}} side files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DictionaryFileStore {

    private final ObjectMapper objectMapper;

    public Path save(Dictionary dictionary, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), dictionary);
            log.info("Dictionary saved to: {} ({})", file, dictionary);
            return file;
        } catch (IOException e) {
            throw new DictionaryException("Failed to save dictionary to " + file, e);
        }
    }

    public Dictionary load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new DictionaryException("Dictionary file not found: " + file);
        }
        try {
            return objectMapper.readValue(file.toFile(), Dictionary.class);
        } catch (IOException e) {
            throw new DictionaryException("Failed to read dictionary " + file, e);
        }
    }
}
