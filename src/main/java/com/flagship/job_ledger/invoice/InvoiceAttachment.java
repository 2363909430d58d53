package com.flagship.job_ledger.invoice;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InvoiceAttachment {
    UUID id;
    UUID invoiceId;
    String name;
    String fileKey;
    String mimeType;
    Instant createdAt;
}
