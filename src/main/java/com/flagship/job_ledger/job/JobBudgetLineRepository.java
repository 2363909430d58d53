package com.flagship.job_ledger.job;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface JobBudgetLineRepository extends JpaRepository<JobBudgetLineEntity, UUID> {

    List<JobBudgetLineEntity> findByJobIdOrderBySortOrderAsc(UUID jobId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM JobBudgetLineEntity l WHERE l.jobId = :jobId")
    int deleteAllForJob(@Param("jobId") UUID jobId);
}
