package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Cost item domain object.
 *
 * Invariants:
 * - totalCost = round2(quantity x unitCost)
 * - a LOCKED item is never changed or deleted
 * - manual items are created OPEN, sourced items are created LOCKED
 */
@Value
public class CostItem {
    UUID id;
    UUID jobId;
    UUID stageId;
    CostType type;
    CostSource source;
    LockStatus lockStatus;
    String supplier;
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal markupPct;
    BigDecimal totalCost;
    Instant incurredAt;
    String requestKey;
    Instant createdAt;
    Instant updatedAt;

    public static CostItem manual(UUID jobId, NewCostItem input, String requestKey) {
        BigDecimal quantity = input.getQuantity() != null ? input.getQuantity() : BigDecimal.ONE;
        BigDecimal unitCost = Money.orZero(input.getUnitCost());
        Instant now = Instant.now();
        return new CostItem(
            UUID.randomUUID(),
            jobId,
            input.getStageId(),
            input.getType(),
            CostSource.manual(),
            LockStatus.OPEN,
            input.getSupplier(),
            input.getDescription().trim(),
            Money.quantity(quantity),
            Money.quantity(unitCost),
            Money.quantity(input.getMarkupPct()),
            Money.lineTotal(quantity, unitCost),
            input.getIncurredAt(),
            requestKey,
            now,
            now
        );
    }

    /**
     * An item posted from an approved source. Created LOCKED.
     */
    public static CostItem locked(UUID jobId, CostType type, CostSource source, String supplier,
                                  String description, BigDecimal quantity, BigDecimal unitCost,
                                  Instant incurredAt) {
        if (source.isManual()) {
            throw new IllegalArgumentException("Locked cost items need a non-manual source");
        }
        BigDecimal qty = quantity != null ? quantity : BigDecimal.ONE;
        BigDecimal cost = Money.orZero(unitCost);
        Instant now = Instant.now();
        return new CostItem(
            UUID.randomUUID(),
            jobId,
            null,
            type,
            source,
            LockStatus.LOCKED,
            supplier,
            description,
            Money.quantity(qty),
            Money.quantity(cost),
            Money.quantity(BigDecimal.ZERO),
            Money.lineTotal(qty, cost),
            incurredAt,
            null,
            now,
            now
        );
    }

    public boolean isLocked() {
        return lockStatus == LockStatus.LOCKED;
    }

    /**
     * @throws CostItemLockedException if this item is locked
     */
    public void ensureMutable() {
        if (isLocked()) {
            throw new CostItemLockedException(id, source);
        }
    }

    /**
     * Merges a partial update and recomputes the total from the merged quantity and unit cost.
     *
     * @throws CostItemLockedException if this item is locked
     */
    public CostItem apply(CostItemUpdate update) {
        ensureMutable();
        BigDecimal newQuantity = update.getQuantity() != null ? update.getQuantity() : quantity;
        BigDecimal newUnitCost = update.getUnitCost() != null ? update.getUnitCost() : unitCost;
        return new CostItem(
            id,
            jobId,
            stageId,
            update.getType() != null ? update.getType() : type,
            source,
            lockStatus,
            update.getSupplier() != null ? update.getSupplier() : supplier,
            update.getDescription() != null ? update.getDescription().trim() : description,
            Money.quantity(newQuantity),
            Money.quantity(newUnitCost),
            update.getMarkupPct() != null ? Money.quantity(update.getMarkupPct()) : markupPct,
            Money.lineTotal(newQuantity, newUnitCost),
            update.getIncurredAt() != null ? update.getIncurredAt() : incurredAt,
            requestKey,
            createdAt,
            Instant.now()
        );
    }
}
