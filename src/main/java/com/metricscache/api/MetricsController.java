package com.metricscache.api;

import com.metricscache.domain.dictionary.DictionaryService;
import com.metricscache.domain.model.FileAggregationRequest;
import com.metricscache.domain.model.FileAggregationResponse;
import com.metricscache.domain.model.MetricsQueryRequest;
import com.metricscache.domain.model.MetricsQueryResponse;
import com.metricscache.domain.model.PopulationJobRequest;
import com.metricscache.domain.service.MetricsQueryService;
import com.metricscache.domain.service.PopulationJobProcessor;
import com.metricscache.infrastructure.persistence.entity.PopulationJobEntity;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST API for metrics queries, population jobs and dictionaries.
 *
 * Endpoints:
 * - POST /api/v1/metrics/query - Group-by query over cached pages
 * - POST /api/v1/metrics/aggregate/files - Group-by over corpus files, written to the output directory
 * - POST /api/v1/metrics/population/jobs - Submit population job
 * - GET /api/v1/metrics/population/jobs/{jobId} - Get job status
 * - POST /api/v1/metrics/population/jobs/{jobId}/resume - Re-queue a failed or interrupted job
 * - POST /api/v1/metrics/dictionary/generate - Build a dictionary from corpus files
 * - POST /api/v1/metrics/dictionary/transform - Encode corpus files
 * - POST /api/v1/metrics/dictionary/regenerate - Decode encoded files
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final MetricsQueryService queryService;
    private final PopulationJobProcessor populationJobProcessor;
    private final DictionaryService dictionaryService;

    /**
     * Request body:
     * {
     *   "metricIds": ["m1"], "tenantIds": ["t1"], "years": [2024], "months": ["01"],
     *   "dimensionSets": [["campaign"]], "groupBy": ["campaign"], "metrics": ["metricValue1"],
     *   "scheme": "SHORTENED", "dictionaryFile": "dictionary.json", "existenceCheck": false
     * }
     */
    @PostMapping("/query")
    public ResponseEntity<MetricsQueryResponse> query(@Valid @RequestBody MetricsQueryRequest request) {
        log.info("Query metrics: metricIds={}, tenantIds={}, groupBy={}",
                request.getMetricIds(), request.getTenantIds(), request.getGroupBy());

        return ResponseEntity.ok(queryService.query(request));
    }

    @PostMapping("/aggregate/files")
    public ResponseEntity<FileAggregationResponse> aggregateFiles(@Valid @RequestBody FileAggregationRequest request) {
        log.info("Aggregate files: pattern={}, groupBy={}", request.getPattern(), request.getGroupBy());

        return ResponseEntity.ok(queryService.aggregateFiles(request));
    }

    /**
     * Response:
     * {
     *   "jobId": "uuid"
     * }
     */
    @PostMapping("/population/jobs")
    public ResponseEntity<Map<String, UUID>> submitPopulationJob(@RequestBody PopulationJobRequest request) {
        log.info("Submit population job: targetCount={}, scheme={}", request.getTargetCount(), request.getScheme());

        UUID jobId = populationJobProcessor.submit(request);

        return ResponseEntity.ok(Map.of("jobId", jobId));
    }

    @GetMapping("/population/jobs/{jobId}")
    public ResponseEntity<PopulationJobEntity> getJobStatus(@PathVariable UUID jobId) {
        log.info("Get job status: jobId={}", jobId);

        return ResponseEntity.ok(populationJobProcessor.getJobStatus(jobId));
    }

    @PostMapping("/population/jobs/{jobId}/resume")
    public ResponseEntity<PopulationJobEntity> resumeJob(@PathVariable UUID jobId) {
        log.info("Resume job: jobId={}", jobId);

        return ResponseEntity.ok(populationJobProcessor.resume(jobId));
    }

    @PostMapping("/dictionary/generate")
    public ResponseEntity<Map<String, String>> generateDictionary(
            @RequestParam String pattern,
            @RequestParam(defaultValue = "dictionary.json") String dictionaryFile) {

        log.info("Generate dictionary: pattern={}, file={}", pattern, dictionaryFile);

        Path file = dictionaryService.generate(pattern, dictionaryFile);

        return ResponseEntity.ok(Map.of("dictionaryFile", file.toString()));
    }

    @PostMapping("/dictionary/transform")
    public ResponseEntity<List<String>> transform(
            @RequestParam String pattern,
            @RequestParam(defaultValue = "dictionary.json") String dictionaryFile,
            @RequestParam(defaultValue = "encoded") String outputFolder) {

        log.info("Transform: pattern={}, file={}, output={}", pattern, dictionaryFile, outputFolder);

        return ResponseEntity.ok(paths(dictionaryService.transform(pattern, dictionaryFile, outputFolder)));
    }

    @PostMapping("/dictionary/regenerate")
    public ResponseEntity<List<String>> regenerate(
            @RequestParam String pattern,
            @RequestParam(defaultValue = "dictionary.json") String dictionaryFile,
            @RequestParam(defaultValue = "encoded") String inputFolder,
            @RequestParam(defaultValue = "regenerated") String outputFolder) {

        log.info("Regenerate: pattern={}, input={}, output={}", pattern, inputFolder, outputFolder);

        return ResponseEntity.ok(paths(dictionaryService.regenerate(inputFolder, pattern, dictionaryFile, outputFolder)));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    private static List<String> paths(List<Path> files) {
        return files.stream().map(Path::toString).collect(Collectors.toList());
    }
}
