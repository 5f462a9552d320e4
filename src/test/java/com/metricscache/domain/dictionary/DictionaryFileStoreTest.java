package com.metricscache.domain.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.exception.DictionaryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryFileStoreTest {

    @TempDir
    Path tempDir;

    private DictionaryFileStore fileStore;

    @BeforeEach
    void setUp() {
        fileStore = new DictionaryFileStore(new ObjectMapper());
    }

    @Test
    void testSaveThenLoad() throws Exception {
        // Given
        Dictionary dictionary = new Dictionary(Map.of("region", 1, "sales", 2), Map.of("A", 1, "10", 2));
        Path file = tempDir.resolve("nested/dictionary.json");

        // When
        fileStore.save(dictionary, file);
        Dictionary loaded = fileStore.load(file);

        // Then
        assertEquals(dictionary, loaded);
        assertEquals("sales", loaded.fieldName("2"));
        assertEquals("10", loaded.value("2"));
        String json = Files.readString(file);
        assertTrue(json.contains("\"keys\""));
        assertTrue(json.contains("\"values\""));
    }

    @Test
    void testLoad_MissingFile() {
        assertThrows(DictionaryException.class, () -> fileStore.load(tempDir.resolve("absent.json")));
    }

    @Test
    void testLoad_Malformed() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        assertThrows(DictionaryException.class, () -> fileStore.load(file));
    }
}
