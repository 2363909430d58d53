package com.flagship.job_ledger.costing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Origin of a cost item: manual entry, a time entry on an approved timesheet,
 * or a line of a posted supplier bill.
 *
 * {@link #key()} is the posting idempotency key. At most one cost item exists
 * per non-manual key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CostSource {

    private static final String SEPARATOR = ":";

    CostSourceKind kind;
    UUID reference;

    public static CostSource manual() {
        return new CostSource(CostSourceKind.MANUAL, null);
    }

    public static CostSource fromTimesheet(UUID timeEntryId) {
        return new CostSource(CostSourceKind.TIMESHEET, Objects.requireNonNull(timeEntryId, "timeEntryId"));
    }

    public static CostSource fromSupplierBillLine(UUID billLineId) {
        return new CostSource(CostSourceKind.SUPPLIER_BILL_LINE, Objects.requireNonNull(billLineId, "billLineId"));
    }

    /**
     * {@code manual}, {@code timesheet:<entryId>} or {@code supplier_bill_line:<lineId>}.
     */
    public String key() {
        return switch (kind) {
            case MANUAL -> kind.getPrefix();
            case TIMESHEET, SUPPLIER_BILL_LINE -> kind.getPrefix() + SEPARATOR + reference;
        };
    }

    /**
     * The unique-column value: null for manual entries, which may repeat.
     */
    public String uniqueKey() {
        return kind.hasReference() ? key() : null;
    }

    public boolean isManual() {
        return kind == CostSourceKind.MANUAL;
    }

    /**
     * Parses a stored key back into its source.
     *
     * @throws IllegalArgumentException on an unknown prefix or a malformed reference
     */
    public static CostSource parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Cost source key is required");
        }
        int separator = key.indexOf(SEPARATOR);
        String prefix = separator < 0 ? key : key.substring(0, separator);
        CostSourceKind kind = CostSourceKind.fromPrefix(prefix)
                .orElseThrow(() -> new IllegalArgumentException("Unknown cost source: " + key));

        return switch (kind) {
            case MANUAL -> {
                if (separator >= 0) {
                    throw new IllegalArgumentException("Manual cost source takes no reference: " + key);
                }
                yield manual();
            }
            case TIMESHEET -> fromTimesheet(referenceOf(key, separator));
            case SUPPLIER_BILL_LINE -> fromSupplierBillLine(referenceOf(key, separator));
        };
    }

    private static UUID referenceOf(String key, int separator) {
        if (separator < 0) {
            throw new IllegalArgumentException("Cost source reference missing: " + key);
        }
        try {
            return UUID.fromString(key.substring(separator + 1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed cost source reference: " + key, e);
        }
    }

    @Override
    public String toString() {
        return key();
    }
}
