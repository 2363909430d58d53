package com.flagship.job_ledger.invoice;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request to raise an invoice. subtotal is the base amount before any
 * variation roll-up; it is ignored for VARIATION invoices.
 */
@Value
@Builder
public class CreateInvoiceCommand {
    UUID jobId;
    InvoiceType type;
    String stageName;
    UUID variationId;
    BigDecimal subtotal;
    BigDecimal vatRate;

    void validate() {
        if (jobId == null) {
            throw new IllegalArgumentException("Job id is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Invoice type is required");
        }
        if (type == InvoiceType.STAGE && (stageName == null || stageName.isBlank())) {
            throw new IllegalArgumentException("Stage name is required for a stage invoice");
        }
        if (type == InvoiceType.VARIATION && variationId == null) {
            throw new IllegalArgumentException("Variation id is required for a variation invoice");
        }
        if (subtotal != null && subtotal.signum() < 0) {
            throw new IllegalArgumentException("Subtotal cannot be negative");
        }
        if (vatRate != null && vatRate.signum() < 0) {
            throw new IllegalArgumentException("VAT rate cannot be negative");
        }
    }
}
