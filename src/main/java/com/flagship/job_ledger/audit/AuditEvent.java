package com.flagship.job_ledger.audit;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One committed state transition, as recorded for the audit trail.
 */
@Value
public class AuditEvent {
    UUID id;
    String entityType;
    UUID entityId;
    String action;
    String actorRole;
    String actor;
    String meta;        // JSON object, may be null
    Instant createdAt;

    public static AuditEvent create(String entityType, UUID entityId, String action,
                                    String actorRole, String actor, String meta) {
        return new AuditEvent(UUID.randomUUID(), entityType, entityId, action,
                actorRole, actor, meta, Instant.now());
    }
}
