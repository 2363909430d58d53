package com.flagship.job_ledger.job;

public enum ChecklistItemStatus {
    PENDING,
    COMPLETED
}
