package com.flagship.job_ledger;

import com.flagship.job_ledger.costing.CostLedgerService;
import com.flagship.job_ledger.invoice.CreateInvoiceCommand;
import com.flagship.job_ledger.invoice.Invoice;
import com.flagship.job_ledger.invoice.InvoiceIssuanceService;
import com.flagship.job_ledger.invoice.InvoiceType;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.timesheet.Engineer;
import com.flagship.job_ledger.timesheet.EngineerService;
import com.flagship.job_ledger.timesheet.Timesheet;
import com.flagship.job_ledger.timesheet.TimesheetApprovalService;
import com.flagship.job_ledger.timesheet.TimesheetService;
import com.flagship.job_ledger.variation.NewVariation;
import com.flagship.job_ledger.variation.Variation;
import com.flagship.job_ledger.variation.VariationDecision;
import com.flagship.job_ledger.variation.VariationItemInput;
import com.flagship.job_ledger.variation.VariationService;
import com.flagship.job_ledger.variation.VariationSettlementService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Races on PostgreSQL row locks. Every caller must succeed and see the
 * winner's result; the ledger must change exactly once.
 */
@Testcontainers(disabledWithoutDocker = true)
class PostgresLedgerConcurrencyTest extends PostgresIntegrationTestSupport {

    private static final int THREADS = 8;

    @Autowired
    private VariationService variationService;

    @Autowired
    private VariationSettlementService settlementService;

    @Autowired
    private TimesheetService timesheetService;

    @Autowired
    private TimesheetApprovalService approvalService;

    @Autowired
    private EngineerService engineerService;

    @Autowired
    private CostLedgerService costLedgerService;

    @Autowired
    private InvoiceIssuanceService invoiceService;

    private <T> List<T> race(Callable<T> call) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<T>> futures = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return call.call();
            }));
        }
        start.countDown();

        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(60, TimeUnit.SECONDS));
        }
        executor.shutdown();
        return results;
    }

    private Variation sentVariation(Job job, String subtotal) {
        Variation draft = variationService.createVariation(NewVariation.builder()
                .jobId(job.getId())
                .title("Garden lighting")
                .vatRate(new BigDecimal("0.2"))
                .item(new VariationItemInput("Garden lighting", BigDecimal.ONE, new BigDecimal(subtotal)))
                .build(), "test-admin");
        return variationService.sendVariation(draft.getId(), "test-admin");
    }

    @Test
    @DisplayName("Racing approvals of one variation all succeed and increment the budget once")
    void variationApprovalRace() throws Exception {
        printTestHeader("Variation approval race on PostgreSQL");
        Job job = createJob("50000");
        Variation variation = sentVariation(job, "5000");

        List<Variation> results = race(() ->
                settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE));

        assertTrue(results.stream().allMatch(Variation::isApproved));
        Job after = jobService.getJob(job.getId());
        printOutput("Budget subtotal", after.getBudgetSubtotal());
        assertEquals(new BigDecimal("55000.00"), after.getBudgetSubtotal());
        assertEquals(new BigDecimal("66000.00"), after.getBudgetTotal());
        printSuccess("Budget incremented exactly once");
    }

    @Test
    @DisplayName("Racing approvals of one timesheet post each entry once")
    void timesheetApprovalRace() throws Exception {
        Job job = createJob("5000");
        Engineer engineer = engineerService.createEngineer("Alex Volt", "alex@example.com",
                new BigDecimal("32"), null);
        Timesheet timesheet = timesheetService.createTimesheet(engineer.getId(), LocalDate.parse("2026-03-02"));
        Instant start = Instant.parse("2026-03-02T08:00:00Z");
        timesheetService.logTimeEntry(timesheet.getId(), job.getId(), start, start.plus(5, ChronoUnit.HOURS), 0);
        timesheetService.submitTimesheet(timesheet.getId());

        List<Timesheet> results = race(() -> approvalService.approveTimesheet(timesheet.getId(), "manager"));

        assertTrue(results.stream().allMatch(Timesheet::isApproved));
        assertEquals(1, costLedgerService.listCostItems(job.getId()).size());
        assertEquals(new BigDecimal("160.00"), costLedgerService.listCostItems(job.getId()).get(0).getTotalCost());
    }

    @Test
    @DisplayName("Racing final invoice requests share one invoice and one number")
    void finalInvoiceRace() throws Exception {
        Job job = createJob("20000");
        CreateInvoiceCommand command = CreateInvoiceCommand.builder()
                .jobId(job.getId())
                .type(InvoiceType.FINAL)
                .subtotal(new BigDecimal("20000"))
                .build();

        List<Invoice> results = race(() -> invoiceService.createInvoiceForJob(command, "test-admin").getInvoice());

        Set<UUID> ids = results.stream().map(Invoice::getId).collect(Collectors.toSet());
        assertEquals(1, ids.size());
        assertEquals(1, countRows("invoices"));
    }
}
