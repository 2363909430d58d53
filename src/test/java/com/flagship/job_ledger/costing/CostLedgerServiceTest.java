package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.supplierbill.SupplierBill;
import com.flagship.job_ledger.supplierbill.SupplierBillLineInput;
import com.flagship.job_ledger.supplierbill.SupplierBillPostingService;
import com.flagship.job_ledger.supplierbill.SupplierBillService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Cost ledger: manual entries are editable, posted entries are not.
 */
class CostLedgerServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private CostLedgerService costLedgerService;

    @Autowired
    private JobCostingService jobCostingService;

    @Autowired
    private SupplierBillService supplierBillService;

    @Autowired
    private SupplierBillPostingService postingService;

    private Job job;

    @BeforeEach
    void setUp() {
        job = createJob("10000");
    }

    private NewCostItem material(String unitCost) {
        return NewCostItem.builder()
                .type(CostType.MATERIAL)
                .description("Copper pipe")
                .quantity(new BigDecimal("2"))
                .unitCost(new BigDecimal(unitCost))
                .build();
    }

    private CostItem postedItem() {
        SupplierBill bill = supplierBillService.createSupplierBill(job.getId(), "Plumb Centre", "PC-1001",
                Instant.now(), List.of(new SupplierBillLineInput("Boiler", BigDecimal.ONE, new BigDecimal("1450"),
                        null)));
        postingService.postSupplierBill(bill.getId(), "test-admin");
        return costLedgerService.listCostItems(job.getId()).stream()
                .filter(CostItem::isLocked)
                .findFirst()
                .orElseThrow();
    }

    @Nested
    @DisplayName("Adding cost items")
    class Adding {

        @Test
        @DisplayName("Manual item is OPEN with total quantity x unit cost")
        void addManual() {
            printTestHeader("Add manual cost item");

            CostItemCreation creation = costLedgerService.addCostItem(job.getId(), material("12.345"), null,
                    "test-admin");
            CostItem item = creation.getItem();
            printOutput("Cost item", item);

            assertFalse(creation.isReplayed());
            assertEquals(LockStatus.OPEN, item.getLockStatus());
            assertTrue(item.getSource().isManual());
            assertEquals(new BigDecimal("24.69"), item.getTotalCost());
            printSuccess("Manual item created OPEN");
        }

        @Test
        @DisplayName("Same idempotency key returns the first item")
        void idempotencyKeyReplay() {
            printTestHeader("Idempotency key replay");

            CostItemCreation first = costLedgerService.addCostItem(job.getId(), material("10"), "req-1", "test-admin");
            CostItemCreation second = costLedgerService.addCostItem(job.getId(), material("99"), "req-1", "test-admin");

            assertTrue(second.isReplayed());
            assertEquals(first.getItem().getId(), second.getItem().getId());
            assertEquals(1, costLedgerService.listCostItems(job.getId()).size());
            printSuccess("Replay returned the original item");
        }

        @Test
        @DisplayName("Idempotency keys are scoped to the job")
        void idempotencyKeyScopedToJob() {
            Job otherJob = createJob("500");

            CostItemCreation first = costLedgerService.addCostItem(job.getId(), material("10"), "shared", "test-admin");
            CostItemCreation second = costLedgerService.addCostItem(otherJob.getId(), material("10"), "shared",
                    "test-admin");

            assertFalse(second.isReplayed());
            assertNotEquals(first.getItem().getId(), second.getItem().getId());
        }

        @Test
        @DisplayName("Manual entries without a key may repeat")
        void manualEntriesRepeat() {
            costLedgerService.addCostItem(job.getId(), material("10"), null, "test-admin");
            costLedgerService.addCostItem(job.getId(), material("10"), null, "test-admin");

            assertEquals(2, costLedgerService.listCostItems(job.getId()).size());
        }

        @Test
        @DisplayName("Invalid input is rejected before anything is written")
        void invalidInput() {
            NewCostItem zeroQuantity = NewCostItem.builder()
                    .type(CostType.MATERIAL)
                    .description("Nothing")
                    .quantity(BigDecimal.ZERO)
                    .build();

            assertThrows(IllegalArgumentException.class,
                    () -> costLedgerService.addCostItem(job.getId(), zeroQuantity, null, "test-admin"));
            assertEquals(0, countRows("cost_items"));
        }

        @Test
        @DisplayName("Unknown job is not found")
        void unknownJob() {
            assertThrows(NotFoundException.class,
                    () -> costLedgerService.addCostItem(UUID.randomUUID(), material("1"), null, "test-admin"));
        }
    }

    @Nested
    @DisplayName("Lock immutability")
    class LockImmutability {

        @Test
        @DisplayName("Open items can be updated and deleted")
        void openItemsMutable() {
            CostItem item = costLedgerService.addCostItem(job.getId(), material("10"), null, "test-admin").getItem();

            CostItem updated = costLedgerService.updateCostItem(item.getId(),
                    CostItemUpdate.builder().unitCost(new BigDecimal("15")).build(), "test-admin");
            assertEquals(new BigDecimal("30.00"), updated.getTotalCost());

            costLedgerService.deleteCostItem(item.getId(), "test-admin");
            assertTrue(costLedgerService.getCostItem(item.getId()).isEmpty());
        }

        @Test
        @DisplayName("Locked items refuse update and delete")
        void lockedItemsImmutable() {
            printTestHeader("Locked item immutability");

            CostItem locked = postedItem();
            printInput("Locked item", locked.getId());

            CostItemLockedException updateError = assertThrows(CostItemLockedException.class,
                    () -> costLedgerService.updateCostItem(locked.getId(),
                            CostItemUpdate.builder().unitCost(BigDecimal.ONE).build(), "test-admin"));
            assertThrows(CostItemLockedException.class,
                    () -> costLedgerService.deleteCostItem(locked.getId(), "test-admin"));
            printExpectedException("CostItemLockedException", updateError.getMessage());

            CostItem reloaded = costLedgerService.getCostItem(locked.getId()).orElseThrow();
            assertEquals(locked.getTotalCost(), reloaded.getTotalCost());
            assertEquals(LockStatus.LOCKED, reloaded.getLockStatus());
            printSuccess("Locked item unchanged");
        }
    }

    @Test
    @DisplayName("Costing summary is deterministic and splits actual from forecast")
    void costingSummary() {
        postedItem();
        costLedgerService.addCostItem(job.getId(), material("100"), null, "test-admin");

        JobCostingSummary first = jobCostingService.getJobCosting(job.getId());
        JobCostingSummary second = jobCostingService.getJobCosting(job.getId());
        JobCostingSummary third = jobCostingService.getJobCosting(job.getId());

        assertEquals(first, second);
        assertEquals(second, third);
        assertEquals(new BigDecimal("10000.00"), first.getBudgetSubtotal());
        assertEquals(new BigDecimal("1450.00"), first.getActualCost());
        assertEquals(new BigDecimal("1650.00"), first.getForecastCost());
    }
}
