package com.flagship.job_ledger.event;

import com.flagship.job_ledger.job.Job;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class JobCompletedEvent implements LedgerEvent {
    UUID eventId;
    UUID jobId;
    String completedBy;
    boolean checklistOverridden;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JobCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Job";
    }

    @Override
    public UUID getAggregateId() {
        return jobId;
    }

    public static JobCompletedEvent from(Job job, String completedBy, boolean checklistOverridden) {
        return new JobCompletedEvent(UUID.randomUUID(), job.getId(), completedBy, checklistOverridden, Instant.now());
    }
}
