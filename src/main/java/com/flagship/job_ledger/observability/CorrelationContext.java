package com.flagship.job_ledger.observability;

import java.util.UUID;

/**
 * Thread-local correlation id and the MDC keys ledger operations log under.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String JOB_ID_MDC_KEY = "jobId";
    public static final String TIMESHEET_ID_MDC_KEY = "timesheetId";
    public static final String BILL_ID_MDC_KEY = "supplierBillId";
    public static final String VARIATION_ID_MDC_KEY = "variationId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form keeps log lines readable.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
