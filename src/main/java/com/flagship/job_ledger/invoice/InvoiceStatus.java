package com.flagship.job_ledger.invoice;

public enum InvoiceStatus {
    DRAFT
}
