package com.flagship.job_ledger.variation;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class VariationItemInput {
    String description;
    BigDecimal quantity;
    BigDecimal unitPrice;
}
