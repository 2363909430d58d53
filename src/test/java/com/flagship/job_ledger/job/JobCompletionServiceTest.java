package com.flagship.job_ledger.job;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.audit.AuditEvent;
import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.exception.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Completion gate: required checklist items block completion unless an admin overrides.
 */
class JobCompletionServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private JobCompletionService completionService;

    @Autowired
    private AuditService auditService;

    private Job job;
    private ChecklistItem isolation;
    private ChecklistItem certificate;

    @BeforeEach
    void setUp() {
        job = createJob("1000");
        isolation = jobService.addChecklistItem(job.getId(), "Isolation test", true);
        certificate = jobService.addChecklistItem(job.getId(), "Upload certificate", true);
        jobService.addChecklistItem(job.getId(), "Tidy site", false);
    }

    private List<String> auditActions() {
        return auditService.listForEntity("job", job.getId()).stream().map(AuditEvent::getAction).toList();
    }

    @Nested
    @DisplayName("Gate")
    class Gate {

        @Test
        @DisplayName("Incomplete required items block completion and are named in the error")
        void blocked() {
            printTestHeader("Completion blocked by checklist");

            ChecklistIncompleteException e = assertThrows(ChecklistIncompleteException.class,
                    () -> completionService.completeJob(job.getId(), "office@example.com", null));
            printExpectedException("ChecklistIncompleteException", e.getMessage());

            assertEquals(2, e.getIncompleteItems().size());
            assertTrue(e.getMessage().contains("2 required checklist item(s)"));
            assertTrue(e.getMessage().contains("Isolation test"));
            assertTrue(e.getMessage().contains(certificate.getId().toString()));
            assertFalse(e.getMessage().contains("Tidy site"));
            assertEquals(JobStatus.NEW, jobService.getJob(job.getId()).getStatus());
        }

        @Test
        @DisplayName("Job completes once every required item is done")
        void completesWhenChecklistDone() {
            jobService.completeChecklistItem(job.getId(), isolation.getId(), "engineer@example.com");
            jobService.completeChecklistItem(job.getId(), certificate.getId(), "engineer@example.com");

            Job completed = completionService.completeJob(job.getId(), "office@example.com", null);

            assertEquals(JobStatus.COMPLETED, completed.getStatus());
            assertNotNull(completed.getCompletedAt());
            assertTrue(auditActions().contains("job.completed"));
            assertFalse(auditActions().contains("job.completion_override"));
        }

        @Test
        @DisplayName("Completing a completed job returns it unchanged")
        void alreadyCompleted() {
            completionService.completeJob(job.getId(), "office@example.com",
                    new CompletionOverride(AuditService.ROLE_ADMIN, "Client signed off on site"));

            Job again = completionService.completeJob(job.getId(), "office@example.com", null);

            assertEquals(JobStatus.COMPLETED, again.getStatus());
            assertEquals(1, auditActions().stream().filter("job.completed"::equals).count());
        }

        @Test
        @DisplayName("Unknown job is not found")
        void unknownJob() {
            assertThrows(NotFoundException.class,
                    () -> completionService.completeJob(UUID.randomUUID(), "office@example.com", null));
        }
    }

    @Nested
    @DisplayName("Override")
    class AdminOverride {

        @Test
        @DisplayName("Admin override completes the job and audits reason and actor")
        void adminOverride() {
            printTestHeader("Admin override");

            Job completed = completionService.completeJob(job.getId(), "boss@example.com",
                    new CompletionOverride(AuditService.ROLE_ADMIN, "Certificate posted separately"));

            assertEquals(JobStatus.COMPLETED, completed.getStatus());
            AuditEvent override = auditService.listForEntity("job", job.getId()).stream()
                    .filter(event -> event.getAction().equals("job.completion_override"))
                    .findFirst()
                    .orElseThrow();
            printOutput("Override audit", override);
            assertEquals("boss@example.com", override.getActor());
            assertEquals(AuditService.ROLE_ADMIN, override.getActorRole());
            assertTrue(override.getMeta().contains("Certificate posted separately"));
            assertTrue(override.getMeta().contains(isolation.getId().toString()));
            printSuccess("Override audited");
        }

        @Test
        @DisplayName("Non-admin override is refused")
        void nonAdminOverride() {
            assertThrows(IllegalArgumentException.class, () -> completionService.completeJob(job.getId(),
                    "client@example.com", new CompletionOverride(AuditService.ROLE_CLIENT, "Please")));
            assertEquals(JobStatus.NEW, jobService.getJob(job.getId()).getStatus());
        }

        @Test
        @DisplayName("An override on a job with nothing pending is ignored, whoever sends it")
        void overrideWithNothingPending() {
            jobService.completeChecklistItem(job.getId(), isolation.getId(), "engineer@example.com");
            jobService.completeChecklistItem(job.getId(), certificate.getId(), "engineer@example.com");

            Job completed = completionService.completeJob(job.getId(), "client@example.com",
                    new CompletionOverride(AuditService.ROLE_CLIENT, null));

            assertEquals(JobStatus.COMPLETED, completed.getStatus());
            assertTrue(auditActions().contains("job.completed"));
            assertFalse(auditActions().contains("job.completion_override"));
        }

        @Test
        @DisplayName("Override without a reason is refused")
        void blankReason() {
            assertThrows(IllegalArgumentException.class, () -> completionService.completeJob(job.getId(),
                    "boss@example.com", new CompletionOverride(AuditService.ROLE_ADMIN, "  ")));
        }
    }

    @Test
    @DisplayName("Completing a checklist item twice keeps the first completion")
    void checklistCompletionIdempotent() {
        ChecklistItem first = jobService.completeChecklistItem(job.getId(), isolation.getId(), "a@example.com");
        ChecklistItem second = jobService.completeChecklistItem(job.getId(), isolation.getId(), "b@example.com");

        assertTrue(second.isCompleted());
        assertEquals(first.getCompletedBy(), second.getCompletedBy());
    }
}
