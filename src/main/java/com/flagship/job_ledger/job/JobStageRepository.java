package com.flagship.job_ledger.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobStageRepository extends JpaRepository<JobStageEntity, UUID> {

    List<JobStageEntity> findByJobIdOrderBySortOrderAsc(UUID jobId);

    Optional<JobStageEntity> findByIdAndJobId(UUID id, UUID jobId);
}
