package com.flagship.job_ledger.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    List<InvoiceEntity> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    Optional<InvoiceEntity> findFirstByJobIdAndTypeOrderByCreatedAtAsc(UUID jobId, InvoiceType type);

    Optional<InvoiceEntity> findFirstByJobIdAndTypeAndStageNameIgnoreCaseOrderByCreatedAtAsc(
            UUID jobId, InvoiceType type, String stageName);

    Optional<InvoiceEntity> findFirstByVariationIdOrderByCreatedAtAsc(UUID variationId);

    @Query("SELECT i.variationId FROM InvoiceEntity i WHERE i.jobId = :jobId AND i.variationId IS NOT NULL")
    List<UUID> findReferencedVariationIdsForJob(@Param("jobId") UUID jobId);
}
