package com.flagship.job_ledger.event;

import com.flagship.job_ledger.variation.Variation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per variation, when the client approves or rejects it.
 * {@code budgetApplied} is true only for an approval that incremented a job budget.
 */
@Value
public class VariationDecidedEvent implements LedgerEvent {
    UUID eventId;
    UUID variationId;
    UUID jobId;
    String status;
    String decidedBy;
    BigDecimal subtotal;
    BigDecimal vat;
    BigDecimal total;
    boolean budgetApplied;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VariationDecided";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Variation";
    }

    @Override
    public UUID getAggregateId() {
        return variationId;
    }

    public static VariationDecidedEvent from(Variation variation, boolean budgetApplied) {
        return new VariationDecidedEvent(
            UUID.randomUUID(),
            variation.getId(),
            variation.getJobId(),
            variation.getStatus().name(),
            variation.getApprovedBy(),
            variation.getSubtotal(),
            variation.getVat(),
            variation.getTotal(),
            budgetApplied,
            Instant.now()
        );
    }
}
