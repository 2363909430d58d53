package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.common.VatCalculator;
import lombok.Value;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * A priced change to a job's scope, sent to the client for a decision.
 *
 * State machine:
 * - DRAFT -> SENT -> APPROVED | REJECTED
 * - DRAFT -> APPROVED | REJECTED (decided without being sent)
 * - APPROVED and REJECTED are terminal
 *
 * Amounts are fixed when the items are set; approval applies exactly the
 * stored subtotal, VAT and total to the job budget.
 */
@Value
public class Variation {
    UUID id;
    String token;
    UUID jobId;
    UUID stageId;
    String title;
    String reason;
    VariationStatus status;
    BigDecimal vatRate;
    BigDecimal subtotal;
    BigDecimal vat;
    BigDecimal total;
    Instant sentAt;
    Instant approvedAt;
    Instant rejectedAt;
    String approvedBy;
    Instant createdAt;
    Instant updatedAt;
    List<VariationItem> items;

    private static final SecureRandom TOKEN_RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 24;

    public static Variation create(UUID id, UUID jobId, UUID stageId, String title, String reason,
                                   BigDecimal vatRate, List<VariationItem> items) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Variation title is required");
        }
        VatCalculator.Amounts amounts = amountsFor(items, vatRate);
        Instant now = Instant.now();
        return new Variation(id, newToken(), jobId, stageId, title.trim(), reason, VariationStatus.DRAFT, vatRate,
                amounts.getSubtotal(), amounts.getVat(), amounts.getTotal(), null, null, null, null, now, now,
                List.copyOf(items));
    }

    static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        TOKEN_RANDOM.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static VatCalculator.Amounts amountsFor(List<VariationItem> items, BigDecimal vatRate) {
        BigDecimal subtotal = items.stream()
                .map(VariationItem::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return VatCalculator.amountsFor(subtotal, vatRate);
    }

    public boolean isPending() {
        return status.isPending();
    }

    public boolean isApproved() {
        return status == VariationStatus.APPROVED;
    }

    /**
     * Replaces the draft's content and recomputes its amounts.
     *
     * @throws IllegalStateException unless DRAFT
     */
    public Variation withDraftChanges(String newTitle, String newReason, BigDecimal newVatRate,
                                      List<VariationItem> newItems) {
        if (status != VariationStatus.DRAFT) {
            throw new IllegalStateException(
                String.format("Cannot edit variation %s in %s status. Only drafts are editable.", id, status));
        }
        String title = newTitle != null ? newTitle : this.title;
        if (title.isBlank()) {
            throw new IllegalArgumentException("Variation title is required");
        }
        BigDecimal rate = newVatRate != null ? newVatRate : vatRate;
        List<VariationItem> lines = newItems != null ? List.copyOf(newItems) : items;
        VatCalculator.Amounts amounts = amountsFor(lines, rate);
        return new Variation(id, token, jobId, stageId, title.trim(), newReason != null ? newReason : reason,
                status, rate, amounts.getSubtotal(), amounts.getVat(), amounts.getTotal(), sentAt, approvedAt,
                rejectedAt, approvedBy, createdAt, Instant.now(), lines);
    }

    /**
     * DRAFT -> SENT. Sending a sent variation is a no-op.
     *
     * @throws IllegalStateException if already decided
     */
    public Variation send() {
        if (status == VariationStatus.SENT) {
            return this;
        }
        if (status != VariationStatus.DRAFT) {
            throw new IllegalStateException(
                String.format("Cannot send variation %s in %s status", id, status));
        }
        Instant now = Instant.now();
        return new Variation(id, token, jobId, stageId, title, reason, VariationStatus.SENT, vatRate, subtotal, vat,
                total, now, approvedAt, rejectedAt, approvedBy, createdAt, now, items);
    }

    /**
     * Records the client's decision.
     *
     * @throws IllegalStateException if no longer pending
     */
    public Variation decide(VariationDecision decision, String decidedBy) {
        if (!isPending()) {
            throw new IllegalStateException(
                String.format("Cannot decide variation %s in %s status", id, status));
        }
        Instant now = Instant.now();
        return switch (decision) {
            case APPROVE -> new Variation(id, token, jobId, stageId, title, reason, VariationStatus.APPROVED,
                    vatRate, subtotal, vat, total, sentAt, now, null, decidedBy, createdAt, now, items);
            case REJECT -> new Variation(id, token, jobId, stageId, title, reason, VariationStatus.REJECTED,
                    vatRate, subtotal, vat, total, sentAt, null, now, decidedBy, createdAt, now, items);
        };
    }

    public VatCalculator.Amounts amounts() {
        return new VatCalculator.Amounts(subtotal, vat, total);
    }
}
