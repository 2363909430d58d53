package com.flagship.job_ledger.job.dto;

import lombok.Value;

/**
 * Optional body of the complete call. A non-blank override reason asks for
 * completion despite pending required checklist items.
 */
@Value
public class CompleteJobRequest {
    String overrideReason;
}
