package com.flagship.job_ledger.variation;

public enum VariationDecision {
    APPROVE,
    REJECT
}
