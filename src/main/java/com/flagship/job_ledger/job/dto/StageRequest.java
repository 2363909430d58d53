package com.flagship.job_ledger.job.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class StageRequest {

    @NotBlank(message = "Stage name is required")
    String name;
}
