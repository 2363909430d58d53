package com.flagship.job_ledger.variation;

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
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "variations")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VariationEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 64)
    private String token;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "stage_id", updatable = false)
    private UUID stageId;

    @Column(nullable = false)
    private String title;

    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private VariationStatus status;

    @Column(name = "vat_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal vatRate;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal vat;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "rejected_at")
    private Instant rejectedAt;

    @Column(name = "approved_by")
    private String approvedBy;

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

    static VariationEntity fromDomain(Variation variation) {
        return new VariationEntity(
            variation.getId(),
            variation.getToken(),
            variation.getJobId(),
            variation.getStageId(),
            variation.getTitle(),
            variation.getReason(),
            variation.getStatus(),
            variation.getVatRate(),
            variation.getSubtotal(),
            variation.getVat(),
            variation.getTotal(),
            variation.getSentAt(),
            variation.getApprovedAt(),
            variation.getRejectedAt(),
            variation.getApprovedBy(),
            null, // set by @PrePersist
            null
        );
    }

    public Variation toDomain(List<VariationItem> items) {
        return new Variation(id, token, jobId, stageId, title, reason, status, vatRate, subtotal, vat, total,
                sentAt, approvedAt, rejectedAt, approvedBy, createdAt, updatedAt, items);
    }

    void updateFromDomain(Variation variation) {
        this.title = variation.getTitle();
        this.reason = variation.getReason();
        this.status = variation.getStatus();
        this.vatRate = variation.getVatRate();
        this.subtotal = variation.getSubtotal();
        this.vat = variation.getVat();
        this.total = variation.getTotal();
        this.sentAt = variation.getSentAt();
        this.approvedAt = variation.getApprovedAt();
        this.rejectedAt = variation.getRejectedAt();
        this.approvedBy = variation.getApprovedBy();
    }
}
