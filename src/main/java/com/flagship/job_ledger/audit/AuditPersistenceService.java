package com.flagship.job_ledger.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes audit rows in their own transaction, so that an audit failure can
 * never mark the business transaction rollback-only.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditPersistenceService {

    private final AuditEventRepository repository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditEvent save(AuditEvent event) {
        AuditEventEntity saved = repository.save(AuditEventEntity.fromDomain(event));
        log.debug("Saved audit event: entityType={}, entityId={}, action={}",
                event.getEntityType(), event.getEntityId(), event.getAction());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<AuditEvent> findForEntity(String entityType, UUID entityId) {
        return repository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId)
                .stream()
                .map(AuditEventEntity::toDomain)
                .toList();
    }
}
