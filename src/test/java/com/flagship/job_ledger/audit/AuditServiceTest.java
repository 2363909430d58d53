package com.flagship.job_ledger.audit;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private AuditService auditService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Test
    @DisplayName("Outside a transaction the event is written immediately")
    void writesImmediately() {
        UUID entityId = UUID.randomUUID();

        auditService.record("job", entityId, "job.note", AuditService.ROLE_SYSTEM, "scheduler", Map.of("note", "hi"));

        List<AuditEvent> events = auditService.listForEntity("job", entityId);
        assertEquals(1, events.size());
        assertEquals("{\"note\":\"hi\"}", events.get(0).getMeta());
        assertEquals(AuditService.ROLE_SYSTEM, events.get(0).getActorRole());
    }

    @Test
    @DisplayName("Rolled-back work leaves no audit event")
    void rollbackLeavesNothing() {
        UUID entityId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> transactionTemplate.executeWithoutResult(status -> {
            auditService.record("job", entityId, "job.note", AuditService.ROLE_ADMIN, "admin", null);
            throw new IllegalStateException("business failure");
        }));

        assertTrue(auditService.listForEntity("job", entityId).isEmpty());
    }

    @Test
    @DisplayName("Committed work is audited after the commit")
    void writtenAfterCommit() {
        UUID entityId = UUID.randomUUID();

        transactionTemplate.executeWithoutResult(status -> {
            auditService.record("job", entityId, "job.first", AuditService.ROLE_ADMIN, "admin", null);
            auditService.record("job", entityId, "job.second", AuditService.ROLE_ADMIN, "admin", null);
            assertEquals(0, countRows("audit_events"));
        });

        List<AuditEvent> events = auditService.listForEntity("job", entityId);
        assertEquals(Set.of("job.first", "job.second"),
                events.stream().map(AuditEvent::getAction).collect(Collectors.toSet()));
    }
}
