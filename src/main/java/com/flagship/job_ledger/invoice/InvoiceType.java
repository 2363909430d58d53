package com.flagship.job_ledger.invoice;

public enum InvoiceType {
    DEPOSIT,
    STAGE,
    VARIATION,
    FINAL
}
