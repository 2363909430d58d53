package com.flagship.job_ledger.timesheet.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TimeEntryRequest {

    @NotNull(message = "Job ID is required")
    UUID jobId;

    @NotNull(message = "Start time is required")
    Instant startedAt;

    Instant endedAt;

    @Min(value = 0, message = "Break minutes cannot be negative")
    Integer breakMinutes;
}
