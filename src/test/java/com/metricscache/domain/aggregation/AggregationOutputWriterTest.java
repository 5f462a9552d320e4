package com.metricscache.domain.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.domain.model.DatasetPageCodec;
import com.metricscache.infrastructure.file.CorpusFileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AggregationOutputWriterTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private AggregationOutputWriter writer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(LocalDateTime.of(2024, 3, 9, 14, 5, 7).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        writer = new AggregationOutputWriter(new CorpusFileRepository(new DatasetPageCodec(objectMapper), objectMapper), clock);
    }

    private static AggregationResult result() {
        AggregationGroup group = new AggregationGroup("A", Map.of("region", "A"), List.of("sales"));
        group.add("sales", 15.0);
        return AggregationResult.builder()
                .groups(List.of(group))
                .coercedValues(Map.of())
                .build();
    }

    @Test
    void testWrite_TimestampedName() throws Exception {
        Path file = writer.write(result(), tempDir, "aggregated_jan", true);

        assertEquals("aggregated_jan_20240309140507.json", file.getFileName().toString());
        List<?> rows = objectMapper.readValue(Files.readString(file), List.class);
        assertEquals(List.of(Map.of("region", "A", "sales", 15.0)), rows);
    }

    @Test
    void testWrite_PlainName() {
        Path file = writer.write(result(), tempDir.resolve("out"), "totals", false);

        assertEquals(tempDir.resolve("out/totals.json"), file);
        assertTrue(Files.exists(file));
    }

    @Test
    void testWrite_RejectsBaseNameOutsideDirectory() {
        Path directory = tempDir.resolve("out");

        assertThrows(IllegalArgumentException.class, () -> writer.write(result(), directory, "../escaped", false));
        assertFalse(Files.exists(tempDir.resolve("escaped.json")));
    }
}
