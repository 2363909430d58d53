package com.flagship.job_ledger.certificate;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "certificates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CertificateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(nullable = false, length = 40)
    private String type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CertificateStatus status;

    @Column(name = "certificate_number", length = 40)
    private String certificateNumber;

    @Column(name = "pdf_key")
    private String pdfKey;

    @Column(name = "issued_at")
    private Instant issuedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static CertificateEntity fromDomain(Certificate certificate) {
        return new CertificateEntity(certificate.getId(), certificate.getJobId(), certificate.getType(),
                certificate.getStatus(), certificate.getCertificateNumber(), certificate.getPdfKey(),
                certificate.getIssuedAt(), null, null);
    }

    public Certificate toDomain() {
        return new Certificate(id, jobId, type, status, certificateNumber, pdfKey, issuedAt, createdAt, updatedAt);
    }

    void updateFromDomain(Certificate certificate) {
        this.status = certificate.getStatus();
        this.certificateNumber = certificate.getCertificateNumber();
        this.pdfKey = certificate.getPdfKey();
        this.issuedAt = certificate.getIssuedAt();
    }
}
