package com.flagship.job_ledger.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "invoice_attachments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceAttachmentEntity {

    static final String PDF_MIME_TYPE = "application/pdf";

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "file_key", nullable = false, length = 500)
    private String fileKey;

    @Column(name = "mime_type", nullable = false, length = 100)
    private String mimeType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    InvoiceAttachmentEntity(UUID invoiceId, String name, String fileKey, String mimeType) {
        this.id = UUID.randomUUID();
        this.invoiceId = invoiceId;
        this.name = name;
        this.fileKey = fileKey;
        this.mimeType = mimeType;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    public InvoiceAttachment toDomain() {
        return new InvoiceAttachment(id, invoiceId, name, fileKey, mimeType, createdAt);
    }
}
