package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.costing.CostItem;
import com.flagship.job_ledger.costing.CostLedgerService;
import com.flagship.job_ledger.costing.CostSource;
import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.job.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Posting a supplier bill turns each line into one locked material cost item.
 */
class SupplierBillPostingServiceTest extends LedgerIntegrationTestSupport {

    private static final Instant BILL_DATE = Instant.parse("2026-02-14T00:00:00Z");

    @Autowired
    private SupplierBillService billService;

    @Autowired
    private SupplierBillPostingService postingService;

    @Autowired
    private CostLedgerService costLedgerService;

    private Job job;
    private SupplierBill bill;

    @BeforeEach
    void setUp() {
        job = createJob("20000");
        bill = billService.createSupplierBill(job.getId(), "City Electrical", "CEF-778", BILL_DATE, List.of(
                new SupplierBillLineInput("Consumer unit", BigDecimal.ONE, new BigDecimal("210.00"), null),
                new SupplierBillLineInput("6mm cable", new BigDecimal("50"), new BigDecimal("1.95"),
                        new BigDecimal("0.2"))));
    }

    @Test
    @DisplayName("Bill totals use per-line VAT")
    void billTotals() {
        assertEquals(SupplierBillStatus.DRAFT, bill.getStatus());
        assertEquals(new BigDecimal("307.50"), bill.getSubtotal());
        assertEquals(new BigDecimal("61.50"), bill.getVat());
        assertEquals(new BigDecimal("369.00"), bill.getTotal());
    }

    @Test
    @DisplayName("Posting creates a locked material item per line, linked back to the line")
    void postingCreatesLockedItems() {
        printTestHeader("Post supplier bill");

        SupplierBill posted = postingService.postSupplierBill(bill.getId(), "test-admin");
        printOutput("Posted bill", posted);

        assertEquals(SupplierBillStatus.POSTED, posted.getStatus());
        assertNotNull(posted.getPostedAt());

        List<CostItem> items = costLedgerService.listCostItems(job.getId());
        assertEquals(2, items.size());
        assertTrue(items.stream().allMatch(CostItem::isLocked));
        assertTrue(items.stream().allMatch(item -> item.getType() == CostType.MATERIAL));
        assertTrue(items.stream().allMatch(item -> "City Electrical".equals(item.getSupplier())));
        assertTrue(items.stream().allMatch(item -> BILL_DATE.equals(item.getIncurredAt())));

        Set<UUID> linked = billService.getSupplierBill(bill.getId()).getLines().stream()
                .map(SupplierBillLine::getCostItemId)
                .collect(Collectors.toSet());
        assertEquals(items.stream().map(CostItem::getId).collect(Collectors.toSet()), linked);

        Set<CostSource> sources = bill.getLines().stream()
                .map(line -> CostSource.fromSupplierBillLine(line.getId()))
                .collect(Collectors.toSet());
        assertEquals(sources, items.stream().map(CostItem::getSource).collect(Collectors.toSet()));
        printSuccess("Lines posted as locked material cost");
    }

    @Test
    @DisplayName("Posting twice creates the same cost items as posting once")
    void postingIsIdempotent() {
        printTestHeader("Post supplier bill twice");

        SupplierBill first = postingService.postSupplierBill(bill.getId(), "test-admin");
        Set<UUID> afterFirst = costLedgerService.listCostItems(job.getId()).stream()
                .map(CostItem::getId)
                .collect(Collectors.toSet());

        SupplierBill second = postingService.postSupplierBill(bill.getId(), "test-admin");
        Set<UUID> afterSecond = costLedgerService.listCostItems(job.getId()).stream()
                .map(CostItem::getId)
                .collect(Collectors.toSet());

        assertEquals(afterFirst, afterSecond);
        assertEquals(first.getId(), second.getId());
        assertEquals(first.getStatus(), second.getStatus());
        assertEquals(first.getSubtotal(), second.getSubtotal());
        printSuccess("Second post was a no-op");
    }

    @Test
    @DisplayName("Posted bill lines cannot be replaced")
    void postedBillIsFrozen() {
        postingService.postSupplierBill(bill.getId(), "test-admin");

        assertThrows(IllegalStateException.class, () -> billService.replaceSupplierBillLines(bill.getId(),
                List.of(new SupplierBillLineInput("Changed", BigDecimal.ONE, BigDecimal.TEN, null))));
    }

    @Test
    @DisplayName("Draft bill lines can be replaced and totals follow")
    void replaceDraftLines() {
        SupplierBill replaced = billService.replaceSupplierBillLines(bill.getId(),
                List.of(new SupplierBillLineInput("Spur", new BigDecimal("2"), new BigDecimal("12.50"), BigDecimal.ZERO)));

        assertEquals(1, replaced.getLines().size());
        assertEquals(new BigDecimal("25.00"), replaced.getSubtotal());
        assertEquals(new BigDecimal("25.00"), replaced.getTotal());
    }
}
