package com.flagship.job_ledger.timesheet.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreateTimesheetRequest {

    @NotNull(message = "Engineer ID is required")
    UUID engineerId;

    @NotNull(message = "Week start is required")
    LocalDate weekStart;
}
