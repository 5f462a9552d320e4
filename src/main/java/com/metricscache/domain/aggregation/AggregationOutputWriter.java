package com.metricscache.domain.aggregation;

import com.metricscache.infrastructure.file.CorpusFileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Writes aggregation groups as a JSON array of flat objects.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AggregationOutputWriter {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    private final CorpusFileRepository files;
    private final Clock clock;

    /**
     * @param timestamped appends {@code _yyyyMMddHHmmss} to the base name
     * @throws IllegalArgumentException when the base name points outside {@code directory}
     */
    public Path write(AggregationResult result, Path directory, String baseName, boolean timestamped) {
        String name = timestamped
                ? baseName + "_" + LocalDateTime.now(clock).format(TIMESTAMP) + ".json"
                : baseName + ".json";
        Path target = files.writeJson(files.resolveWithin(directory, name), result.rows());
        log.info("Aggregated data written to {} ({} groups)", target, result.getGroups().size());
        return target;
    }
}
