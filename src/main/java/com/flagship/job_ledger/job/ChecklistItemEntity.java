package com.flagship.job_ledger.job;

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
@Table(name = "checklist_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChecklistItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String title;

    @Column(nullable = false)
    private boolean required;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ChecklistItemStatus status;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "completed_by")
    private String completedBy;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    static ChecklistItemEntity fromDomain(ChecklistItem item) {
        return new ChecklistItemEntity(item.getId(), item.getJobId(), item.getTitle(), item.isRequired(),
                item.getStatus(), item.getCompletedAt(), item.getCompletedBy(), item.getSortOrder());
    }

    public ChecklistItem toDomain() {
        return new ChecklistItem(id, jobId, title, required, status, completedAt, completedBy, sortOrder);
    }

    void updateFromDomain(ChecklistItem item) {
        this.status = item.getStatus();
        this.completedAt = item.getCompletedAt();
        this.completedBy = item.getCompletedBy();
    }
}
