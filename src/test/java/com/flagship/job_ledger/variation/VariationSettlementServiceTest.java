package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.audit.AuditEvent;
import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.job.JobStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Client decisions on variations and their settlement into the job budget.
 */
class VariationSettlementServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private VariationService variationService;

    @Autowired
    private VariationSettlementService settlementService;

    @Autowired
    private AuditService auditService;

    private Job job;

    @BeforeEach
    void setUp() {
        job = createJob("100000");
    }

    private Variation sentVariation(String subtotal) {
        Variation draft = variationService.createVariation(NewVariation.builder()
                .jobId(job.getId())
                .title("Additional works")
                .reason("Client request")
                .vatRate(new BigDecimal("0.2"))
                .item(new VariationItemInput("Additional works", BigDecimal.ONE, new BigDecimal(subtotal)))
                .build(), "test-admin");
        return variationService.sendVariation(draft.getId(), "test-admin");
    }

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("Approving applies the variation amounts to the budget exactly once")
        void approvalIsExactlyOnce() {
            printTestHeader("Variation approval is exactly-once");
            Variation variation = sentVariation("20000");
            printInput("Variation total", variation.getTotal());

            Variation approved = settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);
            Job afterFirst = jobService.getJob(job.getId());
            printOutput("Budget after first approval", afterFirst.getBudgetSubtotal());

            assertEquals(VariationStatus.APPROVED, approved.getStatus());
            assertEquals("jane@example.com", approved.getApprovedBy());
            assertEquals(new BigDecimal("120000.00"), afterFirst.getBudgetSubtotal());
            assertEquals(new BigDecimal("24000.00"), afterFirst.getBudgetVat());
            assertEquals(new BigDecimal("144000.00"), afterFirst.getBudgetTotal());

            Variation replay = settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);
            Job afterReplay = jobService.getJob(job.getId());

            assertEquals(VariationStatus.APPROVED, replay.getStatus());
            assertEquals(new BigDecimal("120000.00"), afterReplay.getBudgetSubtotal());
            assertEquals(afterFirst.getBudgetTotal(), afterReplay.getBudgetTotal());
            printSuccess("Replay left the budget unchanged");
        }

        @Test
        @DisplayName("Approval is audited as a client decision")
        void approvalAudited() {
            Variation variation = sentVariation("1000");
            settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);

            List<AuditEvent> events = auditService.listForEntity("variation", variation.getId());
            AuditEvent approval = events.stream()
                    .filter(event -> event.getAction().equals("variation.approved"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(AuditService.ROLE_CLIENT, approval.getActorRole());
            assertEquals("jane@example.com", approval.getActor());
        }

        @Test
        @DisplayName("Unknown token is not found")
        void unknownToken() {
            assertThrows(NotFoundException.class,
                    () -> settlementService.decideVariationByToken("no-such-token", VariationDecision.APPROVE));
        }

        @Test
        @DisplayName("Concurrent decisions on one variation increment the budget once")
        void concurrentDecisionsSameVariation() throws InterruptedException {
            printTestHeader("Concurrent decisions, same variation");
            Variation variation = sentVariation("20000");

            int threads = 6;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger approvedResults = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        Variation result = settlementService.decideVariationByToken(variation.getToken(),
                                VariationDecision.APPROVE);
                        if (result.isApproved()) {
                            approvedResults.incrementAndGet();
                        }
                    } catch (Exception e) {
                        System.out.println("Concurrent decision failed: " + e.getMessage());
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            assertTrue(approvedResults.get() >= 1);
            assertEquals(new BigDecimal("120000.00"), jobService.getJob(job.getId()).getBudgetSubtotal());
            printSuccess("Budget incremented once");
        }

        @Test
        @DisplayName("Concurrent approvals of different variations are all applied")
        void concurrentApprovalsDifferentVariations() throws InterruptedException {
            printTestHeader("Concurrent approvals, different variations");
            List<Variation> variations = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                variations.add(sentVariation("1000"));
            }

            ExecutorService executor = Executors.newFixedThreadPool(variations.size());
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(variations.size());
            AtomicInteger failures = new AtomicInteger();

            for (Variation variation : variations) {
                executor.submit(() -> {
                    try {
                        start.await();
                        settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);
                    } catch (Exception e) {
                        failures.incrementAndGet();
                        System.out.println("Concurrent approval failed: " + e.getMessage());
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            assertEquals(0, failures.get());
            Job settled = jobService.getJob(job.getId());
            assertEquals(new BigDecimal("105000.00"), settled.getBudgetSubtotal());
            assertEquals(new BigDecimal("21000.00"), settled.getBudgetVat());
            assertEquals(new BigDecimal("126000.00"), settled.getBudgetTotal());
            printSuccess("No lost increments");
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("Rejection leaves the budget unchanged, and a later approval is ignored")
        void rejectionHasNoImpact() {
            printTestHeader("Rejection has zero impact");
            Variation variation = sentVariation("50000");
            Job before = jobService.getJob(job.getId());

            Variation rejected = settlementService.decideVariationByToken(variation.getToken(), VariationDecision.REJECT);
            Variation retried = settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);
            Job after = jobService.getJob(job.getId());

            assertEquals(VariationStatus.REJECTED, rejected.getStatus());
            assertEquals(VariationStatus.REJECTED, retried.getStatus());
            assertEquals(before.getBudgetSubtotal(), after.getBudgetSubtotal());
            assertEquals(before.getBudgetVat(), after.getBudgetVat());
            assertEquals(before.getBudgetTotal(), after.getBudgetTotal());
            printSuccess("Budget untouched");
        }
    }

    @Nested
    @DisplayName("Authoring")
    class Authoring {

        @Test
        @DisplayName("VAT rate defaults to the configured rate when the job has no quote rate")
        void defaultVatRate() {
            Variation variation = variationService.createVariation(NewVariation.builder()
                    .jobId(job.getId())
                    .title("Extra socket")
                    .item(new VariationItemInput("Socket", BigDecimal.ONE, new BigDecimal("80")))
                    .build(), "test-admin");

            assertEquals(0, new BigDecimal("0.2").compareTo(variation.getVatRate()));
            assertEquals(new BigDecimal("16.00"), variation.getVat());
        }

        @Test
        @DisplayName("Sent variations can no longer be edited")
        void sentNotEditable() {
            Variation variation = sentVariation("100");

            assertThrows(IllegalStateException.class,
                    () -> variationService.updateVariationDraft(variation.getId(), "Changed", null, null, null));
        }

        @Test
        @DisplayName("Stage must belong to the job")
        void foreignStage() {
            Job other = createJob("10", "First fix");
            JobStage foreignStage = jobService.listStages(other.getId()).get(0);

            assertThrows(NotFoundException.class, () -> variationService.createVariation(NewVariation.builder()
                    .jobId(job.getId())
                    .stageId(foreignStage.getId())
                    .title("Wrong stage")
                    .item(new VariationItemInput("Thing", BigDecimal.ONE, BigDecimal.TEN))
                    .build(), "test-admin"));
        }
    }
}
