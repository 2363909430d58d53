package com.flagship.job_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Integration event describing a committed ledger transition.
 *
 * Events are facts: they are written once, in the transaction that made the
 * change, and carry everything a consumer needs without calling back.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
