package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.common.Money;
import com.flagship.job_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Hourly cost rate for an engineer: rate card, then the engineer's own rate,
 * then the configured default, then zero.
 */
@Component
@RequiredArgsConstructor
public class LabourRateResolver {

    private final RateCardRepository rateCardRepository;
    private final LedgerProperties properties;

    public BigDecimal costRateFor(Engineer engineer) {
        if (engineer != null && engineer.getRateCardId() != null) {
            BigDecimal cardRate = rateCardRepository.findById(engineer.getRateCardId())
                    .map(RateCardEntity::getCostRatePerHour)
                    .orElse(null);
            if (cardRate != null) {
                return cardRate;
            }
        }
        if (engineer != null && engineer.getCostRatePerHour() != null) {
            return engineer.getCostRatePerHour();
        }
        return Money.orZero(properties.getCosting().getDefaultCostRatePerHour());
    }
}
