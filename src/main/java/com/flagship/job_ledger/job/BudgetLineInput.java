package com.flagship.job_ledger.job;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One budget line as supplied by a caller. Quantity defaults to 1 and unit price to 0.
 */
@Value
public class BudgetLineInput {
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
}
