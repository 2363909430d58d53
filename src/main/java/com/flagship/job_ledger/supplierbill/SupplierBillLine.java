package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class SupplierBillLine {
    UUID id;
    UUID billId;
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal vatRate;
    BigDecimal totalExVat;
    UUID costItemId;
    int sortOrder;

    static final BigDecimal DEFAULT_VAT_RATE = new BigDecimal("0.2");

    public static SupplierBillLine create(UUID billId, SupplierBillLineInput input, int sortOrder) {
        if (input.getDescription() == null || input.getDescription().isBlank()) {
            throw new IllegalArgumentException("Bill line description is required");
        }
        BigDecimal quantity = input.getQuantity() != null ? input.getQuantity() : BigDecimal.ONE;
        BigDecimal unitCost = Money.orZero(input.getUnitCost());
        BigDecimal vatRate = input.getVatRate() != null ? input.getVatRate() : DEFAULT_VAT_RATE;
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Bill line quantity must be positive");
        }
        if (unitCost.signum() < 0 || vatRate.signum() < 0) {
            throw new IllegalArgumentException("Bill line unit cost and VAT rate cannot be negative");
        }
        return new SupplierBillLine(UUID.randomUUID(), billId, input.getDescription().trim(),
                Money.quantity(quantity), Money.quantity(unitCost), vatRate,
                Money.lineTotal(quantity, unitCost), null, sortOrder);
    }

    public boolean isPosted() {
        return costItemId != null;
    }

    public SupplierBillLine linkCostItem(UUID itemId) {
        return new SupplierBillLine(id, billId, description, quantity, unitCost, vatRate, totalExVat, itemId, sortOrder);
    }
}
