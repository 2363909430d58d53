package com.flagship.job_ledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money helpers shared by every ledger component.
 *
 * All persisted money amounts have scale 2 and are rounded half-up.
 * Quantities, unit prices and rates keep scale 4.
 */
public final class Money {

    public static final int MONEY_SCALE = 2;
    public static final int QUANTITY_SCALE = 4;

    private Money() {
        // Utility class
    }

    /**
     * Rounds an amount to pence, half-up. Null is treated as zero.
     */
    public static BigDecimal round2(BigDecimal amount) {
        return orZero(amount).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal quantity(BigDecimal value) {
        return orZero(value).setScale(QUANTITY_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    /**
     * Line total: quantity x unit price, rounded to pence.
     */
    public static BigDecimal lineTotal(BigDecimal quantity, BigDecimal unitPrice) {
        return round2(orZero(quantity).multiply(orZero(unitPrice)));
    }
}
