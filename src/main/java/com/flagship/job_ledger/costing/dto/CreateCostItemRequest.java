package com.flagship.job_ledger.costing.dto;

import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.costing.NewCostItem;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Request DTO for a manual cost entry.
 */
@Value
public class CreateCostItemRequest {

    @NotNull(message = "Type is required")
    CostType type;

    @NotBlank(message = "Description is required")
    String description;

    @DecimalMin(value = "0", inclusive = false, message = "Quantity must be greater than 0")
    BigDecimal quantity;

    @DecimalMin(value = "0", message = "Unit cost cannot be negative")
    BigDecimal unitCost;

    @DecimalMin(value = "0", message = "Markup cannot be negative")
    BigDecimal markupPct;

    String supplier;

    UUID stageId;

    Instant incurredAt;

    public NewCostItem toNewCostItem() {
        return NewCostItem.builder()
                .type(type)
                .description(description)
                .quantity(quantity)
                .unitCost(unitCost)
                .markupPct(markupPct)
                .supplier(supplier)
                .stageId(stageId)
                .incurredAt(incurredAt)
                .build();
    }
}
