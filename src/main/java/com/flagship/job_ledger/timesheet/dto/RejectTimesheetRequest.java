package com.flagship.job_ledger.timesheet.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class RejectTimesheetRequest {

    @NotBlank(message = "Reason is required")
    String reason;
}
