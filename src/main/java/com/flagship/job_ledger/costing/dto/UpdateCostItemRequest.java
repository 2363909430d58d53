package com.flagship.job_ledger.costing.dto;

import com.flagship.job_ledger.costing.CostItemUpdate;
import com.flagship.job_ledger.costing.CostType;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update; absent fields are left unchanged.
 */
@Value
public class UpdateCostItemRequest {

    CostType type;

    String description;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit cost cannot be negative")
    BigDecimal unitCost;

    @DecimalMin(value = "0", message = "Markup cannot be negative")
    BigDecimal markupPct;

    String supplier;

    Instant incurredAt;

    public CostItemUpdate toUpdate() {
        return CostItemUpdate.builder()
                .type(type)
                .description(description)
                .quantity(quantity)
                .unitCost(unitCost)
                .markupPct(markupPct)
                .supplier(supplier)
                .incurredAt(incurredAt)
                .build();
    }
}
