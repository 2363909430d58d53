package com.flagship.job_ledger.supplierbill.dto;

import com.flagship.job_ledger.supplierbill.SupplierBillLineInput;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class SupplierBillLineRequest {

    @NotBlank(message = "Description is required")
    String description;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit cost cannot be negative")
    BigDecimal unitCost;

    @DecimalMin(value = "0", message = "VAT rate cannot be negative")
    BigDecimal vatRate;

    public SupplierBillLineInput toInput() {
        return new SupplierBillLineInput(description, quantity, unitCost, vatRate);
    }
}
