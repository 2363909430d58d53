package com.flagship.job_ledger.job;

import lombok.Value;

import java.util.UUID;

@Value
public class JobStage {
    UUID id;
    UUID jobId;
    String name;
    int sortOrder;

    public static JobStage create(UUID jobId, String name, int sortOrder) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name is required");
        }
        return new JobStage(UUID.randomUUID(), jobId, name.trim(), sortOrder);
    }
}
