package com.flagship.job_ledger.variation.dto;

import com.flagship.job_ledger.variation.VariationItemInput;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class VariationItemRequest {

    @NotBlank(message = "Description is required")
    String description;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    BigDecimal quantity;

    BigDecimal unitPrice;

    public VariationItemInput toInput() {
        return new VariationItemInput(description, quantity, unitPrice);
    }
}
