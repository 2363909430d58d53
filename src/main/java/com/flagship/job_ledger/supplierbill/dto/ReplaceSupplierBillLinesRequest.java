package com.flagship.job_ledger.supplierbill.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class ReplaceSupplierBillLinesRequest {

    @NotNull(message = "Lines are required")
    @Valid
    List<SupplierBillLineRequest> lines;
}
