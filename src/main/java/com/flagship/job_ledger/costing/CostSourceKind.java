package com.flagship.job_ledger.costing;

import java.util.Arrays;
import java.util.Optional;

/**
 * Where a cost item came from. Only manual entries carry no reference.
 */
public enum CostSourceKind {
    MANUAL("manual"),
    TIMESHEET("timesheet"),
    SUPPLIER_BILL_LINE("supplier_bill_line");

    private final String prefix;

    CostSourceKind(String prefix) {
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }

    public boolean hasReference() {
        return switch (this) {
            case MANUAL -> false;
            case TIMESHEET, SUPPLIER_BILL_LINE -> true;
        };
    }

    static Optional<CostSourceKind> fromPrefix(String prefix) {
        return Arrays.stream(values())
                .filter(kind -> kind.prefix.equals(prefix))
                .findFirst();
    }
}
