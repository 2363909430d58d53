package com.flagship.job_ledger.timesheet.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateEngineerRequest {

    String name;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be a valid address")
    String email;

    @DecimalMin(value = "0", message = "Cost rate cannot be negative")
    BigDecimal costRatePerHour;

    UUID rateCardId;
}
