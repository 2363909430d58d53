package com.flagship.job_ledger.timesheet;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class Engineer {
    UUID id;
    String name;
    String email;
    BigDecimal costRatePerHour;
    UUID rateCardId;

    /**
     * Name when set, otherwise email.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : email;
    }
}
