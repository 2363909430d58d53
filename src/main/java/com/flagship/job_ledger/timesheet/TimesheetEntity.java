package com.flagship.job_ledger.timesheet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "timesheets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TimesheetEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "engineer_id", nullable = false, updatable = false)
    private UUID engineerId;

    @Column(name = "week_start", nullable = false)
    private LocalDate weekStart;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TimesheetStatus status;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "approved_at")
    private Instant approvedAt;

    @Column(name = "approved_by")
    private String approvedBy;

    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static TimesheetEntity fromDomain(Timesheet timesheet) {
        return new TimesheetEntity(timesheet.getId(), timesheet.getEngineerId(), timesheet.getWeekStart(),
                timesheet.getStatus(), timesheet.getSubmittedAt(), timesheet.getApprovedAt(),
                timesheet.getApprovedBy(), timesheet.getNotes(), null, null);
    }

    public Timesheet toDomain() {
        return new Timesheet(id, engineerId, weekStart, status, submittedAt, approvedAt, approvedBy, notes,
                createdAt, updatedAt);
    }

    void updateFromDomain(Timesheet timesheet) {
        this.status = timesheet.getStatus();
        this.submittedAt = timesheet.getSubmittedAt();
        this.approvedAt = timesheet.getApprovedAt();
        this.approvedBy = timesheet.getApprovedBy();
        this.notes = timesheet.getNotes();
    }
}
