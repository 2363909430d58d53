package com.flagship.job_ledger.invoice;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "invoices", uniqueConstraints = @UniqueConstraint(
        name = "uq_invoices_entity_number", columnNames = {"legal_entity_id", "invoice_number"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 64)
    private String token;

    @Column(name = "invoice_number", updatable = false, length = 40)
    private String invoiceNumber;

    @Column(name = "legal_entity_id", updatable = false)
    private UUID legalEntityId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "variation_id", updatable = false)
    private UUID variationId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private InvoiceType type;

    @Column(name = "stage_name", length = 200)
    private String stageName;

    @Column(name = "client_name", nullable = false, length = 200)
    private String clientName;

    @Column(name = "client_email", length = 320)
    private String clientEmail;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "vat_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal vatRate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal vat;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status;

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

    static InvoiceEntity fromDomain(Invoice invoice) {
        return new InvoiceEntity(invoice.getId(), invoice.getToken(), invoice.getInvoiceNumber(),
                invoice.getLegalEntityId(), invoice.getJobId(), invoice.getVariationId(), invoice.getType(),
                invoice.getStageName(), invoice.getClientName(), invoice.getClientEmail(), invoice.getSubtotal(),
                invoice.getVatRate(), invoice.getVat(), invoice.getTotal(), invoice.getStatus(), null, null);
    }

    public Invoice toDomain(List<UUID> variationIds) {
        return new Invoice(id, token, invoiceNumber, legalEntityId, jobId, variationId, type, stageName,
                clientName, clientEmail, subtotal, vatRate, vat, total, status, createdAt, updatedAt,
                List.copyOf(variationIds));
    }
}
