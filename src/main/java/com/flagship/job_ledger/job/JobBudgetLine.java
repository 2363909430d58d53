package com.flagship.job_ledger.job;

import com.flagship.job_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JobBudgetLine {
    UUID id;
    UUID jobId;
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal total;
    int sortOrder;

    public static JobBudgetLine create(UUID jobId, BudgetLineInput input, int sortOrder) {
        if (input.getDescription() == null || input.getDescription().isBlank()) {
            throw new IllegalArgumentException("Budget line description is required");
        }
        BigDecimal quantity = input.getQuantity() != null ? input.getQuantity() : BigDecimal.ONE;
        BigDecimal unitPrice = Money.orZero(input.getUnitPrice());
        if (quantity.signum() < 0 || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("Budget line quantity and unit price cannot be negative");
        }
        return new JobBudgetLine(
            UUID.randomUUID(),
            jobId,
            input.getDescription().trim(),
            Money.quantity(quantity),
            Money.quantity(unitPrice),
            Money.lineTotal(quantity, unitPrice),
            sortOrder
        );
    }
}
