package com.flagship.job_ledger.event;

import com.flagship.job_ledger.variation.Variation;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class VariationSentEvent implements LedgerEvent {
    UUID eventId;
    UUID variationId;
    UUID jobId;
    String token;
    BigDecimal total;
    Instant occurredAt;

    public static final String EVENT_TYPE = "VariationSent";

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

    public static VariationSentEvent from(Variation variation) {
        return new VariationSentEvent(UUID.randomUUID(), variation.getId(), variation.getJobId(),
                variation.getToken(), variation.getTotal(), Instant.now());
    }
}
