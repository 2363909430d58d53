package com.flagship.job_ledger.job;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A job-completion checklist entry. Only required items gate completion.
 */
@Value
public class ChecklistItem {
    UUID id;
    UUID jobId;
    String title;
    boolean required;
    ChecklistItemStatus status;
    Instant completedAt;
    String completedBy;
    int sortOrder;

    public static ChecklistItem create(UUID jobId, String title, boolean required, int sortOrder) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Checklist item title is required");
        }
        return new ChecklistItem(UUID.randomUUID(), jobId, title.trim(), required,
                ChecklistItemStatus.PENDING, null, null, sortOrder);
    }

    public boolean isCompleted() {
        return status == ChecklistItemStatus.COMPLETED;
    }

    public boolean blocksCompletion() {
        return required && !isCompleted();
    }

    /**
     * Completing an already completed item keeps the first completion stamp.
     */
    public ChecklistItem complete(String actor) {
        if (isCompleted()) {
            return this;
        }
        return new ChecklistItem(id, jobId, title, required, ChecklistItemStatus.COMPLETED,
                Instant.now(), actor, sortOrder);
    }
}
