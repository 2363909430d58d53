package com.flagship.job_ledger.invoice;

import lombok.Value;

/**
 * Outcome of an invoice request: the invoice, and whether it already existed.
 */
@Value
public class InvoiceCreation {
    Invoice invoice;
    boolean existing;
}
