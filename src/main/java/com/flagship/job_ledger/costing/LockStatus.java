package com.flagship.job_ledger.costing;

/**
 * OPEN items are editable. LOCKED items came from an approved source and are immutable.
 */
public enum LockStatus {
    OPEN,
    LOCKED
}
