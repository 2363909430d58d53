package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.audit.AuditEvent;
import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.costing.CostItem;
import com.flagship.job_ledger.costing.CostLedgerService;
import com.flagship.job_ledger.costing.CostSource;
import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.costing.LockStatus;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Timesheet approval posts locked labour cost, exactly once per time entry.
 */
class TimesheetApprovalServiceTest extends LedgerIntegrationTestSupport {

    private static final Instant MONDAY_8AM = Instant.parse("2026-03-02T08:00:00Z");

    @Autowired
    private TimesheetService timesheetService;

    @Autowired
    private TimesheetApprovalService approvalService;

    @Autowired
    private EngineerService engineerService;

    @Autowired
    private CostLedgerService costLedgerService;

    @Autowired
    private AuditService auditService;

    private Job job;
    private Engineer engineer;

    @BeforeEach
    void setUp() {
        job = createJob("5000");
        RateCard rateCard = engineerService.createRateCard("Electrician", new BigDecimal("40"));
        engineer = engineerService.createEngineer("Sam Sparks", "sam@example.com", new BigDecimal("30"),
                rateCard.getId());
    }

    /**
     * Two entries: 8h with a 30 minute break, and 4h with none.
     */
    private Timesheet submittedTimesheet() {
        Timesheet timesheet = timesheetService.createTimesheet(engineer.getId(), LocalDate.of(2026, 3, 2));
        timesheetService.logTimeEntry(timesheet.getId(), job.getId(), MONDAY_8AM,
                MONDAY_8AM.plus(8, ChronoUnit.HOURS), 30);
        Instant tuesday = MONDAY_8AM.plus(1, ChronoUnit.DAYS);
        timesheetService.logTimeEntry(timesheet.getId(), job.getId(), tuesday, tuesday.plus(4, ChronoUnit.HOURS), 0);
        return timesheetService.submitTimesheet(timesheet.getId());
    }

    private List<CostItem> labourItems() {
        return costLedgerService.listCostItems(job.getId()).stream()
                .filter(item -> item.getType() == CostType.LABOUR)
                .toList();
    }

    @Nested
    @DisplayName("Approval")
    class Approval {

        @Test
        @DisplayName("Approval posts one locked labour item per entry at the rate card rate")
        void approvalPostsLabour() {
            printTestHeader("Approve timesheet - posts labour");
            Timesheet timesheet = submittedTimesheet();

            Timesheet approved = approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");
            printOutput("Timesheet", approved);

            assertEquals(TimesheetStatus.APPROVED, approved.getStatus());
            assertEquals("manager@example.com", approved.getApprovedBy());

            List<CostItem> labour = labourItems();
            assertEquals(2, labour.size());
            assertTrue(labour.stream().allMatch(item -> item.getLockStatus() == LockStatus.LOCKED));
            assertTrue(labour.stream().allMatch(item -> item.getDescription().equals("Labour (Sam Sparks)")));

            BigDecimal total = labour.stream().map(CostItem::getTotalCost).reduce(BigDecimal.ZERO, BigDecimal::add);
            // 7.5h + 4h at 40/h
            assertEquals(new BigDecimal("460.00"), total);

            Set<CostSource> expectedSources = timesheetService.listEntries(timesheet.getId()).stream()
                    .map(entry -> CostSource.fromTimesheet(entry.getId()))
                    .collect(Collectors.toSet());
            assertEquals(expectedSources, labour.stream().map(CostItem::getSource).collect(Collectors.toSet()));

            assertTrue(timesheetService.listEntries(timesheet.getId()).stream()
                    .allMatch(entry -> entry.getStatus() == TimeEntryStatus.APPROVED && entry.getLockedAt() != null));
            printSuccess("Labour posted and entries locked");
        }

        @Test
        @DisplayName("Approving twice creates the same cost items as approving once")
        void approvalIsIdempotent() {
            printTestHeader("Approve timesheet twice");
            Timesheet timesheet = submittedTimesheet();

            Timesheet first = approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");
            Set<UUID> afterFirst = labourItems().stream().map(CostItem::getId).collect(Collectors.toSet());

            Timesheet second = approvalService.approveTimesheet(timesheet.getId(), "someone-else@example.com");
            Set<UUID> afterSecond = labourItems().stream().map(CostItem::getId).collect(Collectors.toSet());

            assertEquals(afterFirst, afterSecond);
            assertEquals(first.getId(), second.getId());
            assertEquals(first.getStatus(), second.getStatus());
            assertEquals(first.getApprovedBy(), second.getApprovedBy());
            printSuccess("Second approval was a no-op");
        }

        @Test
        @DisplayName("Draft timesheets may be approved directly")
        void draftApproval() {
            Timesheet timesheet = timesheetService.createTimesheet(engineer.getId(), LocalDate.of(2026, 3, 2));
            timesheetService.logTimeEntry(timesheet.getId(), job.getId(), MONDAY_8AM,
                    MONDAY_8AM.plus(2, ChronoUnit.HOURS), 0);

            Timesheet approved = approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");

            assertEquals(TimesheetStatus.APPROVED, approved.getStatus());
            assertEquals(1, labourItems().size());
        }

        @Test
        @DisplayName("Engineer rate applies when there is no rate card")
        void engineerRateFallback() {
            Engineer noCard = engineerService.createEngineer(null, "apprentice@example.com", new BigDecimal("15"),
                    null);
            Timesheet timesheet = timesheetService.createTimesheet(noCard.getId(), LocalDate.of(2026, 3, 2));
            timesheetService.logTimeEntry(timesheet.getId(), job.getId(), MONDAY_8AM,
                    MONDAY_8AM.plus(2, ChronoUnit.HOURS), 0);

            approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");

            CostItem item = labourItems().get(0);
            assertEquals(new BigDecimal("30.00"), item.getTotalCost());
            assertEquals("Labour (apprentice@example.com)", item.getDescription());
        }

        @Test
        @DisplayName("Approval is audited with the posted cost item ids")
        void approvalAudited() {
            Timesheet timesheet = submittedTimesheet();
            approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");

            List<AuditEvent> events = auditService.listForEntity("timesheet", timesheet.getId());
            assertEquals(1, events.size());
            assertEquals("timesheet.approved", events.get(0).getAction());
            assertEquals("manager@example.com", events.get(0).getActor());
            assertTrue(events.get(0).getMeta().contains("costItemIds"));
        }

        @Test
        @DisplayName("Unknown timesheet is not found")
        void unknownTimesheet() {
            assertThrows(NotFoundException.class,
                    () -> approvalService.approveTimesheet(UUID.randomUUID(), "manager@example.com"));
        }

        @Test
        @DisplayName("Concurrent approvals post each entry once")
        void concurrentApprovals() throws InterruptedException {
            printTestHeader("Concurrent timesheet approvals");
            Timesheet timesheet = submittedTimesheet();

            int threads = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger approvedResults = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        Timesheet result = approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");
                        if (result.isApproved()) {
                            approvedResults.incrementAndGet();
                        }
                    } catch (Exception e) {
                        System.out.println("Concurrent approval failed: " + e.getMessage());
                    } finally {
                        done.countDown();
                    }
                });
            }

            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Approved results", approvedResults.get());
            assertTrue(approvedResults.get() >= 1);
            assertEquals(2, labourItems().size());
            printSuccess("No duplicate labour items");
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        @DisplayName("Rejection posts nothing and keeps the reason")
        void rejectionPostsNothing() {
            Timesheet timesheet = submittedTimesheet();

            Timesheet rejected = approvalService.rejectTimesheet(timesheet.getId(), "manager@example.com",
                    "Wrong job code");

            assertEquals(TimesheetStatus.REJECTED, rejected.getStatus());
            assertEquals("Wrong job code", rejected.getNotes());
            assertTrue(labourItems().isEmpty());
            assertTrue(timesheetService.listEntries(timesheet.getId()).stream()
                    .allMatch(entry -> entry.getLockedAt() == null));
        }

        @Test
        @DisplayName("Rejected timesheet cannot be approved")
        void rejectedCannotBeApproved() {
            Timesheet timesheet = submittedTimesheet();
            approvalService.rejectTimesheet(timesheet.getId(), "manager@example.com", "No");

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> approvalService.approveTimesheet(timesheet.getId(), "manager@example.com"));
            printExpectedException("IllegalStateException", e.getMessage());
            assertTrue(labourItems().isEmpty());
        }

        @Test
        @DisplayName("Approved timesheet cannot be rejected")
        void approvedCannotBeRejected() {
            Timesheet timesheet = submittedTimesheet();
            approvalService.approveTimesheet(timesheet.getId(), "manager@example.com");

            assertThrows(IllegalStateException.class,
                    () -> approvalService.rejectTimesheet(timesheet.getId(), "manager@example.com", "Too late"));
            assertEquals(2, labourItems().size());
        }
    }
}
