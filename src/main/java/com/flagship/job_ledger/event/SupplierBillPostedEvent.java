package com.flagship.job_ledger.event;

import com.flagship.job_ledger.supplierbill.SupplierBill;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a supplier bill is posted and its lines become locked material costs.
 */
@Value
public class SupplierBillPostedEvent implements LedgerEvent {
    UUID eventId;
    UUID billId;
    UUID jobId;
    String supplier;
    BigDecimal subtotal;
    List<UUID> costItemIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "SupplierBillPosted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "SupplierBill";
    }

    @Override
    public UUID getAggregateId() {
        return billId;
    }

    public static SupplierBillPostedEvent from(SupplierBill bill, List<UUID> costItemIds) {
        return new SupplierBillPostedEvent(
            UUID.randomUUID(),
            bill.getId(),
            bill.getJobId(),
            bill.getSupplier(),
            bill.getSubtotal(),
            List.copyOf(costItemIds),
            Instant.now()
        );
    }
}
