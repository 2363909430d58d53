package com.flagship.job_ledger.job.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ReplaceBudgetLinesRequest {

    @NotNull(message = "Lines are required")
    @Valid
    List<BudgetLineRequest> lines;
}
