package com.flagship.job_ledger.costing;

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

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for cost items.
 *
 * {@code source} holds the full source key; {@code source_key} holds it only
 * for sourced items and carries the unique constraint that backs posting idempotency.
 */
@Entity
@Table(name = "cost_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CostItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "stage_id")
    private UUID stageId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CostType type;

    @Column(nullable = false, updatable = false, length = 120)
    private String source;

    @Column(name = "source_key", unique = true, updatable = false, length = 120)
    private String sourceKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "lock_status", nullable = false, length = 10)
    private LockStatus lockStatus;

    private String supplier;

    @Column(nullable = false)
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_cost", nullable = false, precision = 19, scale = 4)
    private BigDecimal unitCost;

    @Column(name = "markup_pct", nullable = false, precision = 9, scale = 4)
    private BigDecimal markupPct;

    @Column(name = "total_cost", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "incurred_at")
    private Instant incurredAt;

    @Column(name = "request_key", unique = true, updatable = false)
    private String requestKey;

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

    static CostItemEntity fromDomain(CostItem item) {
        return new CostItemEntity(
            item.getId(),
            item.getJobId(),
            item.getStageId(),
            item.getType(),
            item.getSource().key(),
            item.getSource().uniqueKey(),
            item.getLockStatus(),
            item.getSupplier(),
            item.getDescription(),
            item.getQuantity(),
            item.getUnitCost(),
            item.getMarkupPct(),
            item.getTotalCost(),
            item.getIncurredAt(),
            item.getRequestKey(),
            null, // set by @PrePersist
            null
        );
    }

    public CostItem toDomain() {
        return new CostItem(id, jobId, stageId, type, CostSource.parse(source), lockStatus, supplier,
                description, quantity, unitCost, markupPct, totalCost, incurredAt, requestKey,
                createdAt, updatedAt);
    }

    /**
     * Copies editable fields. Source and lock status are fixed at creation.
     */
    void updateFromDomain(CostItem item) {
        this.type = item.getType();
        this.supplier = item.getSupplier();
        this.description = item.getDescription();
        this.quantity = item.getQuantity();
        this.unitCost = item.getUnitCost();
        this.markupPct = item.getMarkupPct();
        this.totalCost = item.getTotalCost();
        this.incurredAt = item.getIncurredAt();
    }
}
