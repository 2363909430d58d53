package com.flagship.job_ledger.job;

import com.flagship.job_ledger.common.VatCalculator;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Job domain object: the aggregation root of the ledger.
 *
 * The budget snapshot changes only on creation, on budget-line replacement
 * and through approved-variation settlement (an atomic increment in the
 * repository, never through this object).
 */
@Value
public class Job {
    UUID id;
    UUID legalEntityId;
    String title;
    String clientName;
    String clientEmail;
    BigDecimal quoteVatRate;
    JobStatus status;
    BigDecimal budgetSubtotal;
    BigDecimal budgetVat;
    BigDecimal budgetTotal;
    Instant completedAt;
    Instant createdAt;
    Instant updatedAt;

    public static Job create(UUID id, UUID legalEntityId, String title, String clientName, String clientEmail,
                             BigDecimal quoteVatRate, VatCalculator.Amounts budget) {
        Instant now = Instant.now();
        return new Job(
            id,
            legalEntityId,
            title,
            clientName,
            clientEmail,
            quoteVatRate,
            JobStatus.NEW,
            budget.getSubtotal(),
            budget.getVat(),
            budget.getTotal(),
            null,
            now,
            now
        );
    }

    /**
     * The quote's VAT rate when the job came from a quote, otherwise the given default.
     */
    public BigDecimal vatRateOr(BigDecimal defaultRate) {
        return quoteVatRate != null ? quoteVatRate : defaultRate;
    }

    public boolean isCompleted() {
        return status == JobStatus.COMPLETED;
    }

    /**
     * @throws IllegalStateException if the job is already completed
     */
    public Job complete() {
        if (isCompleted()) {
            throw new IllegalStateException("Job " + id + " is already completed");
        }
        Instant now = Instant.now();
        return new Job(id, legalEntityId, title, clientName, clientEmail, quoteVatRate,
                JobStatus.COMPLETED, budgetSubtotal, budgetVat, budgetTotal, now, createdAt, now);
    }

    public Job withBudget(VatCalculator.Amounts budget) {
        return new Job(id, legalEntityId, title, clientName, clientEmail, quoteVatRate, status,
                budget.getSubtotal(), budget.getVat(), budget.getTotal(), completedAt, createdAt, Instant.now());
    }
}
