package com.flagship.job_ledger.timesheet;

public enum TimeEntryStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED
}
