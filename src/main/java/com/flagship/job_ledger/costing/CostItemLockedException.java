package com.flagship.job_ledger.costing;

import java.util.UUID;

/**
 * Raised on any attempt to modify or delete a LOCKED cost item.
 */
public class CostItemLockedException extends IllegalStateException {

    private final UUID costItemId;

    public CostItemLockedException(UUID costItemId, CostSource source) {
        super(String.format(
                "Cost item %s is locked because it originated from an approved source (%s) and cannot be changed",
                costItemId, source.key()));
        this.costItemId = costItemId;
    }

    public UUID getCostItemId() {
        return costItemId;
    }
}
