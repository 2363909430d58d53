package com.flagship.job_ledger.timesheet;

import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * An engineer's week of time entries.
 *
 * DRAFT -> SUBMITTED -> APPROVED | REJECTED. A draft may be approved directly.
 * APPROVED and REJECTED are terminal.
 */
@Value
public class Timesheet {
    UUID id;
    UUID engineerId;
    LocalDate weekStart;
    TimesheetStatus status;
    Instant submittedAt;
    Instant approvedAt;
    String approvedBy;
    String notes;
    Instant createdAt;
    Instant updatedAt;

    public static Timesheet create(UUID engineerId, LocalDate weekStart) {
        if (engineerId == null || weekStart == null) {
            throw new IllegalArgumentException("Engineer and week start are required");
        }
        Instant now = Instant.now();
        return new Timesheet(UUID.randomUUID(), engineerId, weekStart, TimesheetStatus.DRAFT,
                null, null, null, null, now, now);
    }

    public boolean isApproved() {
        return status == TimesheetStatus.APPROVED;
    }

    public boolean isRejected() {
        return status == TimesheetStatus.REJECTED;
    }

    public Timesheet submit() {
        if (status != TimesheetStatus.DRAFT) {
            throw new IllegalStateException(
                String.format("Cannot submit timesheet %s in %s status", id, status));
        }
        Instant now = Instant.now();
        return new Timesheet(id, engineerId, weekStart, TimesheetStatus.SUBMITTED, now,
                approvedAt, approvedBy, notes, createdAt, now);
    }

    /**
     * @throws IllegalStateException unless DRAFT or SUBMITTED
     */
    public Timesheet approve(String approver) {
        if (status != TimesheetStatus.DRAFT && status != TimesheetStatus.SUBMITTED) {
            throw new IllegalStateException(
                String.format("Cannot approve timesheet %s in %s status", id, status));
        }
        Instant now = Instant.now();
        return new Timesheet(id, engineerId, weekStart, TimesheetStatus.APPROVED, submittedAt,
                now, approver, notes, createdAt, now);
    }

    /**
     * Rejection stamps the same approver fields as approval and keeps the reason in notes.
     *
     * @throws IllegalStateException unless DRAFT or SUBMITTED
     */
    public Timesheet reject(String approver, String reason) {
        if (status != TimesheetStatus.DRAFT && status != TimesheetStatus.SUBMITTED) {
            throw new IllegalStateException(
                String.format("Cannot reject timesheet %s in %s status", id, status));
        }
        Instant now = Instant.now();
        return new Timesheet(id, engineerId, weekStart, TimesheetStatus.REJECTED, submittedAt,
                now, approver, reason, createdAt, now);
    }
}
