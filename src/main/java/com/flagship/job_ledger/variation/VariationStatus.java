package com.flagship.job_ledger.variation;

public enum VariationStatus {
    DRAFT,
    SENT,
    APPROVED,
    REJECTED;

    /**
     * Awaiting a client decision.
     */
    public boolean isPending() {
        return this == DRAFT || this == SENT;
    }
}
