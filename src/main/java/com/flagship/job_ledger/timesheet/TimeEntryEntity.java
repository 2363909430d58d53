package com.flagship.job_ledger.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "time_entries")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimeEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "timesheet_id", updatable = false)
    private UUID timesheetId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "engineer_id", nullable = false, updatable = false)
    private UUID engineerId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "break_minutes", nullable = false)
    private int breakMinutes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TimeEntryStatus status;

    @Column(name = "locked_at")
    private Instant lockedAt;

    static TimeEntryEntity fromDomain(TimeEntry entry) {
        return new TimeEntryEntity(entry.getId(), entry.getTimesheetId(), entry.getJobId(), entry.getEngineerId(),
                entry.getStartedAt(), entry.getEndedAt(), entry.getBreakMinutes(), entry.getStatus(),
                entry.getLockedAt());
    }

    public TimeEntry toDomain() {
        return new TimeEntry(id, timesheetId, jobId, engineerId, startedAt, endedAt, breakMinutes, status, lockedAt);
    }

    void updateStatusFromDomain(TimeEntry entry) {
        this.status = entry.getStatus();
        this.lockedAt = entry.getLockedAt();
    }
}
