package com.flagship.job_ledger.audit;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.job.CompletionOverride;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.job.JobCompletionService;
import com.flagship.job_ledger.job.JobStatus;
import com.flagship.job_ledger.variation.NewVariation;
import com.flagship.job_ledger.variation.Variation;
import com.flagship.job_ledger.variation.VariationDecision;
import com.flagship.job_ledger.variation.VariationItemInput;
import com.flagship.job_ledger.variation.VariationService;
import com.flagship.job_ledger.variation.VariationSettlementService;
import com.flagship.job_ledger.variation.VariationStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * A broken audit store must not undo committed ledger changes.
 */
class AuditFailureTest extends LedgerIntegrationTestSupport {

    @MockBean
    private AuditPersistenceService auditPersistenceService;

    @Autowired
    private VariationService variationService;

    @Autowired
    private VariationSettlementService settlementService;

    @Autowired
    private JobCompletionService completionService;

    @BeforeEach
    void breakAuditStore() {
        when(auditPersistenceService.save(any(AuditEvent.class)))
                .thenThrow(new DataAccessResourceFailureException("audit store unavailable"));
    }

    @Test
    @DisplayName("Variation approval commits although the audit write fails")
    void approvalSurvivesAuditFailure() {
        printTestHeader("Audit failure during variation approval");
        Job job = createJob("1000");
        Variation variation = variationService.createVariation(NewVariation.builder()
                .jobId(job.getId())
                .title("Extra")
                .vatRate(new BigDecimal("0.2"))
                .item(new VariationItemInput("Extra", BigDecimal.ONE, new BigDecimal("500")))
                .build(), "test-admin");

        Variation approved = settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);

        assertEquals(VariationStatus.APPROVED, approved.getStatus());
        assertEquals(new BigDecimal("1500.00"), jobService.getJob(job.getId()).getBudgetSubtotal());
        assertEquals(0, countRows("audit_events"));
        verify(auditPersistenceService, atLeastOnce()).save(any(AuditEvent.class));
        printSuccess("Budget settled, audit failure logged");
    }

    @Test
    @DisplayName("Overridden completion commits although the audit write fails")
    void completionSurvivesAuditFailure() {
        Job job = createJob("1000");
        jobService.addChecklistItem(job.getId(), "Isolation test", true);

        Job completed = completionService.completeJob(job.getId(), "boss@example.com",
                new CompletionOverride(AuditService.ROLE_ADMIN, "Signed off by phone"));

        assertEquals(JobStatus.COMPLETED, completed.getStatus());
        assertEquals(JobStatus.COMPLETED, jobService.getJob(job.getId()).getStatus());
    }
}
