package com.metricscache.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricscache.config.MetricsCacheProperties;
import com.metricscache.domain.exception.JobNotFoundException;
import com.metricscache.domain.exception.MetricsCacheException;
import com.metricscache.domain.model.PopulationJobRequest;
import com.metricscache.domain.population.BulkPopulationEngine;
import com.metricscache.domain.population.PopulationRequest;
import com.metricscache.domain.population.PopulationResult;
import com.metricscache.domain.population.SeedCorpus;
import com.metricscache.domain.population.SyntheticKeyFactory;
import com.metricscache.domain.population.SyntheticRecordFactory;
import com.metricscache.infrastructure.persistence.entity.PopulationJobEntity;
import com.metricscache.infrastructure.persistence.repository.PopulationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Background processor for cache population jobs.
 *
 * Population of a large key space takes minutes, so it runs as a job:
 * 1. User submits a job → Job created with PENDING status
 * 2. User receives job ID immediately
 * 3. Scheduled worker picks up pending jobs in creation order
 * 4. Progress (keys written, next offset) is saved after every batch
 * 5. User polls for job status
 *
 * Failure Handling:
 * - A failed batch ends the job as FAILED with the offset reached
 * - Shutdown between batches ends the job as INTERRUPTED
 * - {@link #resume} re-queues either, and the run continues from the saved offset
 * - Jobs a crashed process left RUNNING are re-queued at startup
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PopulationJobProcessor {

    private final PopulationJobRepository jobRepository;
    private final BulkPopulationEngine populationEngine;
    private final MetricsCacheProperties properties;
    private final ObjectMapper objectMapper;

    @Transactional
    public UUID submit(PopulationJobRequest request) {
        if (request.getAxes() == null && request.getTargetCount() == null) {
            throw new IllegalArgumentException("Population job needs either axes or a target count");
        }
        try {
            PopulationJobEntity job = PopulationJobEntity.builder()
                    .requestJson(objectMapper.writeValueAsString(request))
                    .build();

            job = jobRepository.save(job);

            log.info("Population job submitted: {}", job.getJobId());

            return job.getJobId();

        } catch (JsonProcessingException e) {
            log.error("Error submitting population job: {}", e.getMessage(), e);
            throw new MetricsCacheException("Failed to submit population job", e);
        }
    }

    @Transactional(readOnly = true)
    public PopulationJobEntity getJobStatus(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Re-queues a failed or interrupted job; it keeps its offset.
     */
    @Transactional
    public PopulationJobEntity resume(UUID jobId) {
        PopulationJobEntity job = getJobStatus(jobId);
        if (!job.isResumable()) {
            throw new IllegalStateException("Job " + jobId + " is " + job.getStatus() + " and cannot be resumed");
        }
        job.requeue();
        log.info("Population job {} re-queued at offset {}", jobId, job.getNextOffset());
        return jobRepository.save(job);
    }

    /**
     * Jobs run on the scheduler thread of this process, so a job still RUNNING at
     * startup was cut off by a crash or kill. It is re-queued at its last saved offset.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Transactional
    public void requeueOrphanedJobs() {
        List<PopulationJobEntity> orphaned = jobRepository.findByStatus(PopulationJobEntity.JobStatus.RUNNING);
        for (PopulationJobEntity job : orphaned) {
            log.warn("Population job {} was left RUNNING, re-queued at offset {}", job.getJobId(), job.getNextOffset());
            job.requeue();
            jobRepository.save(job);
        }
    }

    /**
     * Runs pending jobs one after another. Not transactional: progress is
     * saved per batch and must survive a failure later in the run.
     */
    @Scheduled(fixedDelayString = "${metrics-cache.population.poll-interval-ms:1000}")
    public void processPendingJobs() {
        List<PopulationJobEntity> pendingJobs = jobRepository
                .findTop10ByStatusOrderByCreatedAtAsc(PopulationJobEntity.JobStatus.PENDING);

        if (pendingJobs.isEmpty()) {
            return;
        }

        log.debug("Processing {} pending population jobs", pendingJobs.size());

        for (PopulationJobEntity job : pendingJobs) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            processJob(job);
        }
    }

    void processJob(PopulationJobEntity job) {
        try {
            log.info("Processing population job: {} (offset {})", job.getJobId(), job.getNextOffset());

            job.markStarted();
            jobRepository.save(job);

            PopulationJobRequest request = objectMapper.readValue(job.getRequestJson(), PopulationJobRequest.class);
            MetricsCacheProperties.Population defaults = properties.getPopulation();

            PopulationRequest populationRequest = PopulationRequest.builder()
                    .axes(request.getAxes())
                    .scheme(request.getScheme() != null ? request.getScheme() : defaults.getDefaultScheme())
                    .targetCount(request.getTargetCount())
                    .volumeKeys(request.getTargetCount() != null ? SyntheticKeyFactory.defaults(request.getSeed()) : null)
                    .batchSize(request.getBatchSize() != null ? request.getBatchSize() : defaults.getBatchSize())
                    .ttlSeconds(request.getTtlSeconds() != null ? request.getTtlSeconds() : defaults.getTtlSeconds())
                    .offset(job.getNextOffset())
                    .build();
            SyntheticRecordFactory recordFactory = new SyntheticRecordFactory(
                    SeedCorpus.defaults(),
                    request.getRecordsPerKey() != null ? request.getRecordsPerKey() : defaults.getRecordsPerKey(),
                    defaults.getMetricValueCount(),
                    request.getSeed());

            PopulationResult result = populationEngine.populate(populationRequest, recordFactory, written -> {
                job.recordProgress(written);
                jobRepository.save(job);
            });

            job.markFinished(toJobStatus(result), result.getNextOffset(), result.getErrorMessage());
            jobRepository.save(job);

            log.info("Population job {} finished: {} ({} ms)", job.getJobId(), result, job.getExecutionTimeMs());

        } catch (Exception e) {
            log.error("Error processing population job {}: {}", job.getJobId(), e.getMessage(), e);

            job.markFinished(PopulationJobEntity.JobStatus.FAILED, job.getNextOffset(), e.getMessage());
            jobRepository.save(job);
        }
    }

    private static PopulationJobEntity.JobStatus toJobStatus(PopulationResult result) {
        return switch (result.getStatus()) {
            case COMPLETED -> PopulationJobEntity.JobStatus.COMPLETED;
            case FAILED -> PopulationJobEntity.JobStatus.FAILED;
            case INTERRUPTED -> PopulationJobEntity.JobStatus.INTERRUPTED;
        };
    }
}
