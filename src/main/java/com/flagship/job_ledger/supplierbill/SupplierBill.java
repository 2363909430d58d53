package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.common.VatCalculator;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A supplier's bill against a job. DRAFT bills are editable; POSTED is terminal.
 *
 * subtotal = sum of line totals ex VAT, vat = sum of per-line VAT, total = subtotal + vat.
 */
@Value
public class SupplierBill {
    UUID id;
    UUID jobId;
    String supplier;
    String reference;
    Instant billDate;
    SupplierBillStatus status;
    Instant postedAt;
    BigDecimal subtotal;
    BigDecimal vat;
    BigDecimal total;
    Instant createdAt;
    Instant updatedAt;
    List<SupplierBillLine> lines;

    public static SupplierBill create(UUID id, UUID jobId, String supplier, String reference, Instant billDate,
                                      List<SupplierBillLine> lines) {
        if (supplier == null || supplier.isBlank()) {
            throw new IllegalArgumentException("Supplier is required");
        }
        VatCalculator.Amounts totals = totalsFor(lines);
        Instant now = Instant.now();
        return new SupplierBill(id, jobId, supplier.trim(), reference, billDate, SupplierBillStatus.DRAFT, null,
                totals.getSubtotal(), totals.getVat(), totals.getTotal(), now, now, List.copyOf(lines));
    }

    public static VatCalculator.Amounts totalsFor(List<SupplierBillLine> lines) {
        VatCalculator.Amounts totals = VatCalculator.Amounts.zero();
        for (SupplierBillLine line : lines) {
            totals = totals.plus(VatCalculator.amountsFor(line.getTotalExVat(), line.getVatRate()));
        }
        return totals;
    }

    public boolean isPosted() {
        return status == SupplierBillStatus.POSTED;
    }

    /**
     * Cost items are dated by the bill date, falling back to when the bill was recorded.
     */
    public Instant costIncurredAt() {
        return billDate != null ? billDate : createdAt;
    }

    /**
     * @throws IllegalStateException once posted
     */
    public SupplierBill withLines(List<SupplierBillLine> newLines) {
        if (isPosted()) {
            throw new IllegalStateException(
                String.format("Cannot change lines of supplier bill %s in %s status", id, status));
        }
        VatCalculator.Amounts totals = totalsFor(newLines);
        return new SupplierBill(id, jobId, supplier, reference, billDate, status, postedAt,
                totals.getSubtotal(), totals.getVat(), totals.getTotal(), createdAt, Instant.now(),
                List.copyOf(newLines));
    }

    /**
     * @throws IllegalStateException if already posted
     */
    public SupplierBill post(List<SupplierBillLine> postedLines) {
        if (isPosted()) {
            throw new IllegalStateException(String.format("Supplier bill %s is already posted", id));
        }
        Instant now = Instant.now();
        return new SupplierBill(id, jobId, supplier, reference, billDate, SupplierBillStatus.POSTED, now,
                subtotal, vat, total, createdAt, now, List.copyOf(postedLines));
    }
}
