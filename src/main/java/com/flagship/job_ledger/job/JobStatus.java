package com.flagship.job_ledger.job;

public enum JobStatus {
    NEW,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED
}
