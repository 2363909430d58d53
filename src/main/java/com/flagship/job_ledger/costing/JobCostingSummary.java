package com.flagship.job_ledger.costing;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Budget against actual (locked) and forecast (all) cost for one job.
 * Margin percentages are fractions, so 0.75 means 75%.
 */
@Value
public class JobCostingSummary {
    UUID jobId;
    BigDecimal budgetSubtotal;
    BigDecimal actualCost;
    BigDecimal forecastCost;
    BigDecimal actualMargin;
    BigDecimal forecastMargin;
    BigDecimal actualMarginPct;
    BigDecimal forecastMarginPct;
}
