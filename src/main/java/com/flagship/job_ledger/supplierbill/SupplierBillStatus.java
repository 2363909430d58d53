package com.flagship.job_ledger.supplierbill;

public enum SupplierBillStatus {
    DRAFT,
    POSTED
}
