package com.flagship.job_ledger.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ChecklistItemRepository extends JpaRepository<ChecklistItemEntity, UUID> {

    List<ChecklistItemEntity> findByJobIdOrderBySortOrderAsc(UUID jobId);

    long countByJobId(UUID jobId);
}
