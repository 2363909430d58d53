package com.flagship.job_ledger.costing;

import lombok.Value;

/**
 * Result of a manual add: the item, and whether it was returned for a repeated request key.
 */
@Value
public class CostItemCreation {
    CostItem item;
    boolean replayed;
}
