package com.flagship.job_ledger.variation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Variation authoring input. A null VAT rate means the job's quote rate,
 * then the configured default.
 */
@Value
@Builder
public class NewVariation {
    UUID jobId;
    UUID stageId;
    String title;
    String reason;
    BigDecimal vatRate;
    @Singular
    List<VariationItemInput> items;
}
