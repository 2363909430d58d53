package com.flagship.job_ledger.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit rows are insert-only.
 */
@Entity
@Table(name = "audit_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditEventEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "entity_type", nullable = false, updatable = false, length = 60)
    private String entityType;

    @Column(name = "entity_id", nullable = false, updatable = false)
    private UUID entityId;

    @Column(nullable = false, updatable = false, length = 100)
    private String action;

    @Column(name = "actor_role", nullable = false, updatable = false, length = 40)
    private String actorRole;

    @Column(updatable = false)
    private String actor;

    @Column(updatable = false, length = 4000)
    private String meta;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static AuditEventEntity fromDomain(AuditEvent event) {
        return new AuditEventEntity(
            event.getId(),
            event.getEntityType(),
            event.getEntityId(),
            event.getAction(),
            event.getActorRole(),
            event.getActor(),
            event.getMeta(),
            event.getCreatedAt()
        );
    }

    public AuditEvent toDomain() {
        return new AuditEvent(id, entityType, entityId, action, actorRole, actor, meta, createdAt);
    }
}
