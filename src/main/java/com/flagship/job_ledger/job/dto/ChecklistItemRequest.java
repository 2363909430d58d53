package com.flagship.job_ledger.job.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ChecklistItemRequest {

    @NotBlank(message = "Title is required")
    String title;

    /**
     * Defaults to true.
     */
    Boolean required;
}
