package com.flagship.job_ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort audit sink.
 *
 * When called inside a transaction the record is written only after that
 * transaction commits, so rolled-back work never leaves an audit row behind.
 * Outside a transaction it is written immediately. Either way, a failure is
 * logged and swallowed: the audit trail must never undo a committed ledger change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_CLIENT = "client";
    public static final String ROLE_SYSTEM = "system";

    private final AuditPersistenceService persistenceService;
    private final ObjectMapper objectMapper;

    public void record(String entityType, UUID entityId, String action,
                       String actorRole, String actor, Map<String, ?> meta) {
        AuditEvent event = AuditEvent.create(entityType, entityId, action, actorRole, actor, toJson(meta));

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(event);
                }
            });
        } else {
            write(event);
        }
    }

    public List<AuditEvent> listForEntity(String entityType, UUID entityId) {
        return persistenceService.findForEntity(entityType, entityId);
    }

    private void write(AuditEvent event) {
        try {
            persistenceService.save(event);
        } catch (RuntimeException e) {
            log.warn("Audit write failed, continuing: entityType={}, entityId={}, action={}, error={}",
                    event.getEntityType(), event.getEntityId(), event.getAction(), e.getMessage());
        }
    }

    private String toJson(Map<String, ?> meta) {
        if (meta == null || meta.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            log.warn("Audit metadata could not be serialized: {}", e.getMessage());
            return null;
        }
    }
}
