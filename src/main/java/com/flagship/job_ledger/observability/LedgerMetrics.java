package com.flagship.job_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Counters and timers for ledger operations.
 *
 * Metrics exposed:
 * - ledger.cost_items: cost ledger writes, by operation and outcome
 * - ledger.postings: timesheet and supplier-bill postings, by source and outcome
 * - ledger.variation.decisions: by decision and outcome
 * - ledger.invoices: by invoice type and outcome ("created" or "existing")
 * - ledger.job.completions: by outcome
 * - ledger.latency: per operation
 * - idempotency.cache: request-key lookups, hit or miss
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCostItem(String operation, String status) {
        registry.counter("ledger.cost_items",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPosting(String source, String status) {
        registry.counter("ledger.postings",
                "source", sanitizeTag(source),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordVariationDecision(String decision, String status) {
        registry.counter("ledger.variation.decisions",
                "decision", sanitizeTag(decision),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordInvoice(String type, String status) {
        registry.counter("ledger.invoices",
                "type", sanitizeTag(type),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordJobCompletion(String status) {
        registry.counter("ledger.job.completions", "status", sanitizeTag(status)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
