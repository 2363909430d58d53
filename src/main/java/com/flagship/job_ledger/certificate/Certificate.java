package com.flagship.job_ledger.certificate;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A compliance certificate for a job (EICR, gas safety and similar). Numbered when issued.
 */
@Value
public class Certificate {
    UUID id;
    UUID jobId;
    String type;
    CertificateStatus status;
    String certificateNumber;
    String pdfKey;
    Instant issuedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Certificate draft(UUID jobId, String type, String pdfKey) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Certificate type is required");
        }
        Instant now = Instant.now();
        return new Certificate(UUID.randomUUID(), jobId, type.trim(), CertificateStatus.DRAFT, null, pdfKey,
                null, now, now);
    }

    public boolean isIssued() {
        return status == CertificateStatus.ISSUED;
    }

    /**
     * Issued certificates with a rendered document can be attached to invoices.
     */
    public boolean isAttachable() {
        return isIssued() && pdfKey != null && !pdfKey.isBlank();
    }

    public String attachmentName() {
        return type + " Certificate";
    }

    /**
     * @throws IllegalStateException if already issued
     */
    public Certificate issue(String number) {
        if (isIssued()) {
            throw new IllegalStateException(String.format("Certificate %s is already issued", id));
        }
        Instant now = Instant.now();
        return new Certificate(id, jobId, type, CertificateStatus.ISSUED, number, pdfKey, now, createdAt, now);
    }

    public Certificate withPdfKey(String key) {
        return new Certificate(id, jobId, type, status, certificateNumber, key, issuedAt, createdAt, Instant.now());
    }
}
