package com.flagship.job_ledger.event;

import com.flagship.job_ledger.invoice.Invoice;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class InvoiceCreatedEvent implements LedgerEvent {
    UUID eventId;
    UUID invoiceId;
    UUID jobId;
    String invoiceType;
    String stageName;
    String invoiceNumber;
    BigDecimal subtotal;
    BigDecimal vat;
    BigDecimal total;
    List<UUID> variationIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InvoiceCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Invoice";
    }

    @Override
    public UUID getAggregateId() {
        return invoiceId;
    }

    public static InvoiceCreatedEvent from(Invoice invoice) {
        return new InvoiceCreatedEvent(
            UUID.randomUUID(),
            invoice.getId(),
            invoice.getJobId(),
            invoice.getType().name(),
            invoice.getStageName(),
            invoice.getInvoiceNumber(),
            invoice.getSubtotal(),
            invoice.getVat(),
            invoice.getTotal(),
            invoice.getVariationIds(),
            Instant.now()
        );
    }
}
