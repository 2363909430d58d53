package com.flagship.job_ledger.supplierbill;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Quantity defaults to 1, unit cost to 0, VAT rate to 0.2.
 */
@Value
public class SupplierBillLineInput {
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal vatRate;
}
