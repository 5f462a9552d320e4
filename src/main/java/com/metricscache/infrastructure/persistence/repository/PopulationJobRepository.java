package com.metricscache.infrastructure.persistence.repository;

import com.metricscache.infrastructure.persistence.entity.PopulationJobEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PopulationJobRepository extends JpaRepository<PopulationJobEntity, UUID> {

    List<PopulationJobEntity> findTop10ByStatusOrderByCreatedAtAsc(PopulationJobEntity.JobStatus status);

    List<PopulationJobEntity> findByStatus(PopulationJobEntity.JobStatus status);
}
