package com.flagship.job_ledger.costing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Partial update of a cost item. Null fields keep their current value.
 */
@Value
@Builder
public class CostItemUpdate {
    CostType type;
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal markupPct;
    String supplier;
    Instant incurredAt;

    public void validate() {
        if (description != null && description.isBlank()) {
            throw new IllegalArgumentException("Cost item description cannot be blank");
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
