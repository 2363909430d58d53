package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.certificate.Certificate;
import com.flagship.job_ledger.certificate.CertificateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Attaches a job's issued certificates to its completion invoice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceAttachmentService {

    private final CertificateService certificateService;
    private final InvoiceAttachmentRepository attachmentRepository;

    @Transactional
    public List<InvoiceAttachment> attachCertificates(Invoice invoice) {
        List<Certificate> certificates = certificateService.attachableCertificates(invoice.getJobId());
        for (Certificate certificate : certificates) {
            if (attachmentRepository.existsByInvoiceIdAndFileKey(invoice.getId(), certificate.getPdfKey())) {
                continue;
            }
            attachmentRepository.save(new InvoiceAttachmentEntity(invoice.getId(), certificate.attachmentName(),
                    certificate.getPdfKey(), InvoiceAttachmentEntity.PDF_MIME_TYPE));
        }
        log.debug("Attached {} certificate(s) to invoice {}", certificates.size(), invoice.getId());
        return listAttachments(invoice.getId());
    }

    @Transactional(readOnly = true)
    public List<InvoiceAttachment> listAttachments(UUID invoiceId) {
        return attachmentRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId).stream()
                .map(InvoiceAttachmentEntity::toDomain)
                .toList();
    }
}
