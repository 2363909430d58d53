package com.flagship.job_ledger.variation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class CreateVariationRequest {

    UUID stageId;

    @NotBlank(message = "Title is required")
    String title;

    String reason;

    @DecimalMin(value = "0", message = "VAT rate cannot be negative")
    BigDecimal vatRate;

    @Valid
    List<VariationItemRequest> items;
}
