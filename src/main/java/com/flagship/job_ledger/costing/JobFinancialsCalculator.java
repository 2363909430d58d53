package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.common.Money;
import com.flagship.job_ledger.job.JobBudgetLine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.UUID;

/**
 * Pure costing arithmetic. Same inputs, same summary.
 */
public final class JobFinancialsCalculator {

    private static final int PCT_SCALE = 4;

    private JobFinancialsCalculator() {
        // Utility class
    }

    /**
     * @param budgetSubtotalFallback used only when there are no budget lines; null means 0
     */
    public static JobCostingSummary compute(UUID jobId, List<JobBudgetLine> budgetLines,
                                            BigDecimal budgetSubtotalFallback, List<CostItem> costItems) {
        BigDecimal budget = budgetLines.isEmpty()
                ? Money.round2(budgetSubtotalFallback)
                : Money.round2(budgetLines.stream()
                        .map(JobBudgetLine::getTotal)
                        .map(Money::orZero)
                        .reduce(BigDecimal.ZERO, BigDecimal::add));

        BigDecimal actual = BigDecimal.ZERO;
        BigDecimal forecast = BigDecimal.ZERO;
        for (CostItem item : costItems) {
            BigDecimal total = costItemTotal(item);
            forecast = forecast.add(total);
            if (item.isLocked()) {
                actual = actual.add(total);
            }
        }
        actual = Money.round2(actual);
        forecast = Money.round2(forecast);

        BigDecimal actualMargin = budget.subtract(actual);
        BigDecimal forecastMargin = budget.subtract(forecast);

        return new JobCostingSummary(
            jobId,
            budget,
            actual,
            forecast,
            actualMargin,
            forecastMargin,
            marginPct(actualMargin, budget),
            marginPct(forecastMargin, budget)
        );
    }

    /**
     * The stored total when non-zero, otherwise quantity (default 1) x unit cost (default 0).
     */
    static BigDecimal costItemTotal(CostItem item) {
        BigDecimal stored = item.getTotalCost();
        if (stored != null && stored.signum() != 0) {
            return stored;
        }
        BigDecimal quantity = item.getQuantity() != null ? item.getQuantity() : BigDecimal.ONE;
        return Money.lineTotal(quantity, item.getUnitCost());
    }

    private static BigDecimal marginPct(BigDecimal margin, BigDecimal budget) {
        if (budget.signum() <= 0) {
            return BigDecimal.ZERO.setScale(PCT_SCALE);
        }
        return margin.divide(budget, PCT_SCALE, RoundingMode.HALF_UP);
    }
}
