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

/**
 * Marks a variation as billed by a stage invoice. The unique variation_id
 * constraint is the last line of defence against billing it twice.
 */
@Entity
@Table(name = "invoice_variations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InvoiceVariationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "variation_id", nullable = false, unique = true, updatable = false)
    private UUID variationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    InvoiceVariationEntity(UUID invoiceId, UUID variationId) {
        this.id = UUID.randomUUID();
        this.invoiceId = invoiceId;
        this.variationId = variationId;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }
}
