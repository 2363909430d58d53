package com.flagship.job_ledger.job.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating a job manually.
 */
@Value
public class CreateJobRequest {

    UUID legalEntityId;

    String title;

    @NotBlank(message = "Client name is required")
    String clientName;

    @Email(message = "Client email must be a valid address")
    String clientEmail;

    @DecimalMin(value = "0", message = "VAT rate cannot be negative")
    BigDecimal quoteVatRate;

    @Valid
    List<BudgetLineRequest> budgetLines;

    List<String> stages;
}
