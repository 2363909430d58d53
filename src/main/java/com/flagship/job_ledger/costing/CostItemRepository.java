package com.flagship.job_ledger.costing;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CostItemRepository extends JpaRepository<CostItemEntity, UUID> {

    List<CostItemEntity> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    Optional<CostItemEntity> findBySourceKey(String sourceKey);

    Optional<CostItemEntity> findByRequestKey(String requestKey);

    long countBySourceKey(String sourceKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CostItemEntity c WHERE c.id = :id")
    Optional<CostItemEntity> findByIdForUpdate(@Param("id") UUID id);
}
