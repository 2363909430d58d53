package com.flagship.job_ledger.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceVariationRepository extends JpaRepository<InvoiceVariationEntity, UUID> {

    List<InvoiceVariationEntity> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);

    Optional<InvoiceVariationEntity> findByVariationId(UUID variationId);

    @Query("""
            SELECT iv.variationId FROM InvoiceVariationEntity iv
            WHERE iv.invoiceId IN (SELECT i.id FROM InvoiceEntity i WHERE i.jobId = :jobId)
            """)
    List<UUID> findBilledVariationIdsForJob(@Param("jobId") UUID jobId);
}
