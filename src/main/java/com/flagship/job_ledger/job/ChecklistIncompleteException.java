package com.flagship.job_ledger.job;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Thrown when a job is completed while required checklist items are still pending.
 */
public class ChecklistIncompleteException extends IllegalStateException {

    private final UUID jobId;
    private final List<ChecklistItem> incompleteItems;

    public ChecklistIncompleteException(UUID jobId, List<ChecklistItem> incompleteItems) {
        super(String.format("Job %s cannot be completed: %d required checklist item(s) incomplete: %s",
                jobId,
                incompleteItems.size(),
                incompleteItems.stream()
                        .map(item -> item.getTitle() + " [" + item.getId() + "]")
                        .collect(Collectors.joining(", "))));
        this.jobId = jobId;
        this.incompleteItems = List.copyOf(incompleteItems);
    }

    public UUID getJobId() {
        return jobId;
    }

    public List<ChecklistItem> getIncompleteItems() {
        return incompleteItems;
    }
}
