package com.flagship.job_ledger.invoice.dto;

import com.flagship.job_ledger.invoice.CreateInvoiceCommand;
import com.flagship.job_ledger.invoice.InvoiceType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreateInvoiceRequest {

    @NotNull(message = "Type is required")
    InvoiceType type;

    String stageName;

    UUID variationId;

    @DecimalMin(value = "0", message = "Subtotal cannot be negative")
    BigDecimal subtotal;

    @DecimalMin(value = "0", message = "VAT rate cannot be negative")
    BigDecimal vatRate;

    public CreateInvoiceCommand toCommand(UUID jobId) {
        return CreateInvoiceCommand.builder()
                .jobId(jobId)
                .type(type)
                .stageName(stageName)
                .variationId(variationId)
                .subtotal(subtotal)
                .vatRate(vatRate)
                .build();
    }
}
