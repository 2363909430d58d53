package com.flagship.job_ledger.costing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Manual cost entry input. Quantity defaults to 1, unit cost and markup to 0.
 */
@Value
@Builder
public class NewCostItem {
    CostType type;
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal markupPct;
    String supplier;
    UUID stageId;
    Instant incurredAt;

    /**
     * @throws IllegalArgumentException on a missing type, a blank description,
     *         a non-positive quantity or a negative unit cost
     */
    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("Cost type is required");
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Cost item description is required");
        }
        if (quantity != null && quantity.signum() <= 0) {
            throw new IllegalArgumentException("Cost item quantity must be positive");
        }
        if (unitCost != null && unitCost.signum() < 0) {
            throw new IllegalArgumentException("Cost item unit cost cannot be negative");
        }
        if (markupPct != null && markupPct.signum() < 0) {
            throw new IllegalArgumentException("Markup cannot be negative");
        }
    }
}
