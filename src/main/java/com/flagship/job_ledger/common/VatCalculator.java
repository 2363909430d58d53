package com.flagship.job_ledger.common;

import lombok.Value;

import java.math.BigDecimal;

/**
 * The single place VAT is derived from a subtotal.
 *
 * Invoices, variations, supplier bills and job budgets all go through this
 * class so that invoice VAT and budget VAT stay reconcilable.
 */
public final class VatCalculator {

    private VatCalculator() {
        // Utility class
    }

    /**
     * VAT for a subtotal: round2(subtotal x rate).
     *
     * @throws IllegalArgumentException if the rate is negative
     */
    public static BigDecimal vatFor(BigDecimal subtotal, BigDecimal vatRate) {
        BigDecimal rate = Money.orZero(vatRate);
        if (rate.signum() < 0) {
            throw new IllegalArgumentException("VAT rate cannot be negative: " + vatRate);
        }
        return Money.round2(Money.orZero(subtotal).multiply(rate));
    }

    /**
     * Gross total: subtotal + vat, both already at money scale.
     */
    public static BigDecimal totalFor(BigDecimal subtotal, BigDecimal vat) {
        return Money.round2(subtotal).add(Money.round2(vat));
    }

    public static Amounts amountsFor(BigDecimal subtotal, BigDecimal vatRate) {
        BigDecimal net = Money.round2(subtotal);
        BigDecimal vat = vatFor(net, vatRate);
        return new Amounts(net, vat, totalFor(net, vat));
    }

    /**
     * Subtotal, VAT and total triple.
     */
    @Value
    public static class Amounts {
        BigDecimal subtotal;
        BigDecimal vat;
        BigDecimal total;

        public static Amounts zero() {
            BigDecimal zero = Money.round2(BigDecimal.ZERO);
            return new Amounts(zero, zero, zero);
        }

        public Amounts plus(Amounts other) {
            return new Amounts(subtotal.add(other.subtotal), vat.add(other.vat), total.add(other.total));
        }
    }
}
