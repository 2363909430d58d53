package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.common.VatCalculator;
import lombok.Value;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A client invoice raised against a job.
 *
 * variationIds lists the approved variations this invoice bills, either the
 * single variation of a VARIATION invoice or those rolled into a STAGE invoice.
 */
@Value
public class Invoice {
    UUID id;
    String token;
    String invoiceNumber;
    UUID legalEntityId;        // numbering scope, null when the job has none
    UUID jobId;
    UUID variationId;
    InvoiceType type;
    String stageName;
    String clientName;
    String clientEmail;
    BigDecimal subtotal;
    BigDecimal vatRate;
    BigDecimal vat;
    BigDecimal total;
    InvoiceStatus status;
    Instant createdAt;
    Instant updatedAt;
    List<UUID> variationIds;

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 24;
    private static final Pattern COMPLETION_STAGE = Pattern.compile("complete|completion");

    public static Invoice draft(UUID legalEntityId, UUID jobId, InvoiceType type, String stageName,
                                UUID variationId, String clientName, String clientEmail, BigDecimal vatRate,
                                VatCalculator.Amounts amounts, String invoiceNumber, List<UUID> variationIds) {
        Instant now = Instant.now();
        return new Invoice(UUID.randomUUID(), newToken(), invoiceNumber, legalEntityId, jobId, variationId, type,
                stageName, clientName, clientEmail, amounts.getSubtotal(), vatRate, amounts.getVat(), amounts.getTotal(),
                InvoiceStatus.DRAFT, now, now, List.copyOf(variationIds));
    }

    static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        TOKEN_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Final invoices and stage invoices for a completion stage carry the job's certificates.
     */
    public boolean isCompletionInvoice() {
        if (type == InvoiceType.FINAL) {
            return true;
        }
        return type == InvoiceType.STAGE
                && stageName != null
                && COMPLETION_STAGE.matcher(stageName.toLowerCase(Locale.ROOT)).find();
    }

    public Invoice withVariationIds(List<UUID> ids) {
        return new Invoice(id, token, invoiceNumber, legalEntityId, jobId, variationId, type, stageName, clientName,
                clientEmail, subtotal, vatRate, vat, total, status, createdAt, updatedAt, List.copyOf(ids));
    }
}
