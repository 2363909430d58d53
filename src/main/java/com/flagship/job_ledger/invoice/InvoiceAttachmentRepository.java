package com.flagship.job_ledger.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InvoiceAttachmentRepository extends JpaRepository<InvoiceAttachmentEntity, UUID> {

    List<InvoiceAttachmentEntity> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);

    boolean existsByInvoiceIdAndFileKey(UUID invoiceId, String fileKey);
}
