package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class VariationItem {
    UUID id;
    UUID variationId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal total;
    int sortOrder;

    public static VariationItem create(UUID variationId, VariationItemInput input, int sortOrder) {
        if (input.getDescription() == null || input.getDescription().isBlank()) {
            throw new IllegalArgumentException("Variation item description is required");
        }
        BigDecimal quantity = input.getQuantity() != null ? input.getQuantity() : BigDecimal.ONE;
        BigDecimal unitPrice = Money.orZero(input.getUnitPrice());
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Variation item quantity must be positive");
        }
        return new VariationItem(UUID.randomUUID(), variationId, input.getDescription().trim(),
                Money.quantity(quantity), Money.quantity(unitPrice), Money.lineTotal(quantity, unitPrice), sortOrder);
    }
}
