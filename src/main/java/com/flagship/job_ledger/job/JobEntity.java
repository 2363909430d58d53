package com.flagship.job_ledger.job;

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
import org.hibernate.annotations.DynamicUpdate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for jobs.
 *
 * Dynamic updates: a status change must not rewrite budget columns that a
 * concurrent variation approval may have incremented in the meantime.
 */
@Entity
@Table(name = "jobs")
@DynamicUpdate
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "legal_entity_id", updatable = false)
    private UUID legalEntityId;

    private String title;

    @Column(name = "client_name", nullable = false)
    private String clientName;

    @Column(name = "client_email")
    private String clientEmail;

    @Column(name = "quote_vat_rate", precision = 7, scale = 4)
    private BigDecimal quoteVatRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    @Column(name = "budget_subtotal", nullable = false, precision = 19, scale = 2)
    private BigDecimal budgetSubtotal;

    @Column(name = "budget_vat", nullable = false, precision = 19, scale = 2)
    private BigDecimal budgetVat;

    @Column(name = "budget_total", nullable = false, precision = 19, scale = 2)
    private BigDecimal budgetTotal;

    @Column(name = "completed_at")
    private Instant completedAt;

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

    static JobEntity fromDomain(Job job) {
        return new JobEntity(
            job.getId(),
            job.getLegalEntityId(),
            job.getTitle(),
            job.getClientName(),
            job.getClientEmail(),
            job.getQuoteVatRate(),
            job.getStatus(),
            job.getBudgetSubtotal(),
            job.getBudgetVat(),
            job.getBudgetTotal(),
            job.getCompletedAt(),
            null, // set by @PrePersist
            null
        );
    }

    public Job toDomain() {
        return new Job(id, legalEntityId, title, clientName, clientEmail, quoteVatRate, status,
                budgetSubtotal, budgetVat, budgetTotal, completedAt, createdAt, updatedAt);
    }

    /**
     * Status transitions only. Budget columns are not touched here.
     */
    void updateStatusFromDomain(Job job) {
        this.status = job.getStatus();
        this.completedAt = job.getCompletedAt();
    }

    /**
     * Explicit budget replacement. Callers hold the row lock.
     */
    void replaceBudget(Job job) {
        this.budgetSubtotal = job.getBudgetSubtotal();
        this.budgetVat = job.getBudgetVat();
        this.budgetTotal = job.getBudgetTotal();
    }
}
