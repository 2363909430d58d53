package com.flagship.job_ledger.variation.dto;

import com.flagship.job_ledger.variation.VariationDecision;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class DecisionRequest {

    @NotNull(message = "Decision is required")
    VariationDecision decision;
}
