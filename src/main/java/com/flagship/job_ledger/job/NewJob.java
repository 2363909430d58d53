package com.flagship.job_ledger.job;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Manual job creation input.
 */
@Value
@Builder
public class NewJob {
    UUID legalEntityId;
    String title;
    String clientName;
    String clientEmail;
    BigDecimal quoteVatRate;
    @Singular
    List<BudgetLineInput> budgetLines;
    @Singular
    List<String> stageNames;
}
