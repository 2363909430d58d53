package com.flagship.job_ledger.supplierbill.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class CreateSupplierBillRequest {

    @NotBlank(message = "Supplier is required")
    String supplier;

    String reference;

    Instant billDate;

    @NotNull(message = "Lines are required")
    @Valid
    List<SupplierBillLineRequest> lines;
}
