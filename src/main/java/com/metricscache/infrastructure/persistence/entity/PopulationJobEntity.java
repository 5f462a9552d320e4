package com.metricscache.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Entity tracking a cache population run.
 *
 * The request is stored as JSON; {@code nextOffset} is the number of targets
 * already written, so a failed or interrupted job can resume where it stopped.
 */
@Entity
@Table(name = "population_jobs", indexes = {
    @Index(name = "idx_population_status", columnList = "status"),
    @Index(name = "idx_population_created_at", columnList = "createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PopulationJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String requestJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    @Builder.Default
    private long keysWritten = 0;

    @Column(nullable = false)
    @Builder.Default
    private long nextOffset = 0;

    @Column(length = 500)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum JobStatus {
        PENDING,
        RUNNING,
        COMPLETED,
        FAILED,
        INTERRUPTED
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        this.status = JobStatus.RUNNING;
        this.startedAt = Instant.now();
        this.completedAt = null;
        this.errorMessage = null;
    }

    public void recordProgress(long written) {
        this.keysWritten = written;
        this.nextOffset = written;
    }

    public void markFinished(JobStatus status, long nextOffset, String error) {
        this.status = status;
        this.keysWritten = nextOffset;
        this.nextOffset = nextOffset;
        this.errorMessage = error != null && error.length() > 500 ? error.substring(0, 500) : error;
        this.completedAt = Instant.now();
    }

    /**
     * Back to PENDING; the offset is kept so the next run continues from it.
     */
    public void requeue() {
        this.status = JobStatus.PENDING;
        this.completedAt = null;
    }

    /**
     * Failed and interrupted jobs go back to the queue, keeping their offset.
     */
    public boolean isResumable() {
        return status == JobStatus.FAILED || status == JobStatus.INTERRUPTED;
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
