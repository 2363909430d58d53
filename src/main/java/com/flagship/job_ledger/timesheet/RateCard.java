package com.flagship.job_ledger.timesheet;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class RateCard {
    UUID id;
    String name;
    BigDecimal costRatePerHour;
}
