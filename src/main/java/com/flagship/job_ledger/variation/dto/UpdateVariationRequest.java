package com.flagship.job_ledger.variation.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Draft edit; absent fields keep their value, a present item list replaces all items.
 */
@Value
public class UpdateVariationRequest {

    String title;

    String reason;

    @DecimalMin(value = "0", message = "VAT rate cannot be negative")
    BigDecimal vatRate;

    @Valid
    List<VariationItemRequest> items;
}
