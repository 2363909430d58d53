package com.flagship.job_ledger.timesheet;

public enum TimesheetStatus {
    DRAFT,
    SUBMITTED,
    APPROVED,
    REJECTED
}
