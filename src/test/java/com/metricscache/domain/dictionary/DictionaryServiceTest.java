package com.metricscache.domain.dictionary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.exception.DictionaryException;
import com.metricscache.domain.model.DatasetPage;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.file.CorpusFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DictionaryServiceTest {

    @TempDir
    Path tempDir;

    private CorpusFileRepository corpusFiles;
    private DictionaryService dictionaryService;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        corpusFiles = new CorpusFileRepository(new DatasetPageCodec(objectMapper), objectMapper);

        MetricsCacheProperties properties = new MetricsCacheProperties();
        properties.getStorage().setDataDir(tempDir.resolve("data").toString());
        properties.getStorage().setOutputDir(tempDir.resolve("output").toString());

        dictionaryService = new DictionaryService(corpusFiles, new DictionaryCodec(),
                new DictionaryFileStore(objectMapper), properties);

        Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(tempDir.resolve("data/jan_records.json"),
                "[{\"key\":\"m1_t1_2024_01\",\"value\":[{\"region\":\"A\",\"sales\":\"10\"},{\"region\":\"B\",\"sales\":\"5\"}]}]");
        Files.writeString(tempDir.resolve("data/feb_records.json"),
                "[{\"key\":\"m1_t1_2024_02\",\"value\":[{\"region\":\"A\",\"sales\":\"7\"}]}]");
        Files.writeString(tempDir.resolve("data/jan_notes.json"), "[]");
    }

    @Test
    void testGenerate_CoversAllMatchingFiles() {
        // When
        Path file = dictionaryService.generate("_", "dictionary.json");

        // Then
        assertTrue(Files.exists(file));
        Dictionary dictionary = dictionaryService.load("dictionary.json");
        assertEquals(Map.of("region", 1, "sales", 2), dictionary.getKeyCodes());
        // feb sorts before jan
        assertEquals(List.of("A", "7", "10", "B", "5"), List.copyOf(dictionary.getValueCodes().keySet()));
    }

    @Test
    void testTransformThenRegenerate_RestoresRecords() {
        // Given
        dictionaryService.generate("jan", "dictionary.json");

        // When
        List<Path> encoded = dictionaryService.transform("jan", "dictionary.json", "encoded");
        List<Path> regenerated = dictionaryService.regenerate("encoded", "jan", "dictionary.json", "regenerated");

        // Then
        assertEquals(1, encoded.size());
        assertEquals(1, regenerated.size());
        assertEquals("regenerated_jan_records.json", regenerated.get(0).getFileName().toString());

        List<DatasetPage> original = corpusFiles.readPages(tempDir.resolve("data/jan_records.json"));
        List<DatasetPage> restored = corpusFiles.readPages(regenerated.get(0));
        assertEquals(original, restored);

        DatasetPage encodedPage = corpusFiles.readPages(encoded.get(0)).get(0);
        assertTrue(encodedPage.getRecords().get(0).containsKey("1"));
    }

    @Test
    void testGenerate_NoMatchingFiles() {
        assertThrows(DictionaryException.class, () -> dictionaryService.generate("march", "dictionary.json"));
    }

    @Test
    void testLoad_MissingDictionary() {
        assertThrows(DictionaryException.class, () -> dictionaryService.load("absent.json"));
    }

    @Test
    void testGenerate_RejectsDictionaryFileOutsideDataDir() {
        assertThrows(IllegalArgumentException.class, () -> dictionaryService.generate("jan", "../dictionary.json"));
        assertFalse(Files.exists(tempDir.resolve("dictionary.json")));
    }

    @Test
    void testLoad_RejectsAbsolutePath() {
        String absolute = tempDir.resolve("data/dictionary.json").toAbsolutePath().toString();

        assertThrows(IllegalArgumentException.class, () -> dictionaryService.load(absolute));
    }

    @Test
    void testTransformAndRegenerate_RejectFoldersOutsideOutputDir() {
        // Given
        dictionaryService.generate("jan", "dictionary.json");

        // When / Then
        assertThrows(IllegalArgumentException.class,
                () -> dictionaryService.transform("jan", "dictionary.json", "../../elsewhere"));
        assertThrows(IllegalArgumentException.class,
                () -> dictionaryService.regenerate("../data", "jan", "dictionary.json", "regenerated"));
        assertFalse(Files.exists(tempDir.getParent().resolve("elsewhere")));
    }
}
