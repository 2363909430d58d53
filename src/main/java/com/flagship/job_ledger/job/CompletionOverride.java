package com.flagship.job_ledger.job;

import lombok.Value;

/**
 * Admin override of the completion checklist. Both fields are required.
 */
@Value
public class CompletionOverride {
    String actorRole;
    String reason;
}
