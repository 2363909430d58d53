package com.flagship.job_ledger.timesheet;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

@Value
public class TimeEntry {
    UUID id;
    UUID timesheetId;
    UUID jobId;
    UUID engineerId;
    Instant startedAt;
    Instant endedAt;
    int breakMinutes;
    TimeEntryStatus status;
    Instant lockedAt;

    private static final BigDecimal MINUTES_PER_HOUR = BigDecimal.valueOf(60);

    public static TimeEntry create(UUID timesheetId, UUID jobId, UUID engineerId,
                                   Instant startedAt, Instant endedAt, int breakMinutes) {
        if (jobId == null || engineerId == null || startedAt == null) {
            throw new IllegalArgumentException("Job, engineer and start time are required");
        }
        if (breakMinutes < 0) {
            throw new IllegalArgumentException("Break minutes cannot be negative");
        }
        if (endedAt != null && endedAt.isBefore(startedAt)) {
            throw new IllegalArgumentException("Time entry cannot end before it starts");
        }
        return new TimeEntry(UUID.randomUUID(), timesheetId, jobId, engineerId, startedAt, endedAt,
                breakMinutes, TimeEntryStatus.DRAFT, null);
    }

    /**
     * Worked hours: max(0, (end - start) - break) / 60, to 4 dp. Zero while still running.
     */
    public BigDecimal workedHours() {
        if (endedAt == null) {
            return BigDecimal.ZERO;
        }
        long minutes = Duration.between(startedAt, endedAt).toMinutes() - breakMinutes;
        if (minutes <= 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(minutes).divide(MINUTES_PER_HOUR, 4, RoundingMode.HALF_UP);
    }

    public TimeEntry submit() {
        return withStatus(TimeEntryStatus.SUBMITTED, lockedAt);
    }

    public TimeEntry lock(Instant at) {
        return withStatus(TimeEntryStatus.APPROVED, at);
    }

    public TimeEntry unlock() {
        return withStatus(TimeEntryStatus.REJECTED, null);
    }

    private TimeEntry withStatus(TimeEntryStatus newStatus, Instant newLockedAt) {
        return new TimeEntry(id, timesheetId, jobId, engineerId, startedAt, endedAt, breakMinutes,
                newStatus, newLockedAt);
    }
}
