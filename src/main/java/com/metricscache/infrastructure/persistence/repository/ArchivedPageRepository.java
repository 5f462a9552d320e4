package com.metricscache.infrastructure.persistence.repository;

import com.metricscache.infrastructure.persistence.entity.ArchivedPageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Archived pages for cold-start fallback.
 */
@Repository
public interface ArchivedPageRepository extends JpaRepository<ArchivedPageEntity, String> {

    List<ArchivedPageEntity> findByCacheKeyIn(Collection<String> cacheKeys);
}
