package com.metricscache.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable copy of a dataset page, keyed by its cache key.
 *
 * Read when a queried key has expired from the cache.
 */
@Entity
@Table(name = "archived_pages", indexes = {
    @Index(name = "idx_archived_at", columnList = "archivedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchivedPageEntity {

    @Id
    @Column(length = 512)
    private String cacheKey;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private Instant archivedAt;

    @PrePersist
    protected void onCreate() {
        if (archivedAt == null) {
            archivedAt = Instant.now();
        }
    }
}
