package com.flagship.job_ledger.job.dto;

import com.flagship.job_ledger.job.BudgetLineInput;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BudgetLineRequest {

    @NotBlank(message = "Description is required")
    String description;

    @DecimalMin(value = "0", message = "Quantity cannot be negative")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit price cannot be negative")
    BigDecimal unitPrice;

    public BudgetLineInput toInput() {
        return new BudgetLineInput(description, quantity, unitPrice);
    }
}
