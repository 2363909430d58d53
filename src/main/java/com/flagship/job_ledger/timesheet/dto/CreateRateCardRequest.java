package com.flagship.job_ledger.timesheet.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class CreateRateCardRequest {

    @NotBlank(message = "Name is required")
    String name;

    @NotNull(message = "Cost rate is required")
    @DecimalMin(value = "0", message = "Cost rate cannot be negative")
    BigDecimal costRatePerHour;
}
