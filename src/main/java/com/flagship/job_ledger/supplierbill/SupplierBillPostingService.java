package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.costing.CostItem;
import com.flagship.job_ledger.costing.CostItemPersistenceService;
import com.flagship.job_ledger.costing.CostSource;
import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.event.SupplierBillPostedEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import com.flagship.job_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts supplier bills to the cost ledger.
 *
 * One locked MATERIAL item per bill line (source key {@code supplier_bill_line:<lineId>}),
 * its id written back onto the line. The bill row is locked first so that
 * concurrent posts serialise; the loser sees POSTED and returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplierBillPostingService {

    private static final String POSTING_SOURCE = "supplier_bill";

    private final SupplierBillRepository billRepository;
    private final SupplierBillLineRepository lineRepository;
    private final CostItemPersistenceService costItemPersistenceService;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerMetrics metrics;

    /**
     * Posts a bill. Posting an already posted bill returns it unchanged.
     *
     * @throws NotFoundException if the bill does not exist
     */
    @Transactional
    public SupplierBill postSupplierBill(UUID billId, String actor) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.BILL_ID_MDC_KEY, billId.toString());

        log.info("Attempting to post supplier bill: actor={}", actor);

        try {
            SupplierBillEntity entity = billRepository.findByIdForUpdate(billId)
                    .orElseThrow(() -> NotFoundException.of("SupplierBill", billId));
            List<SupplierBillLineEntity> lineEntities = lineRepository.findByBillIdOrderBySortOrderAsc(billId);
            SupplierBill bill = entity.toDomain(lineEntities.stream().map(SupplierBillLineEntity::toDomain).toList());

            if (bill.isPosted()) {
                log.info("Supplier bill already posted at {}", bill.getPostedAt());
                metrics.recordPosting(POSTING_SOURCE, "already_posted");
                return bill;
            }

            MDC.put(CorrelationContext.JOB_ID_MDC_KEY, bill.getJobId().toString());
            List<UUID> costItemIds = new ArrayList<>();
            List<SupplierBillLine> postedLines = new ArrayList<>();

            for (SupplierBillLineEntity lineEntity : lineEntities) {
                SupplierBillLine line = lineEntity.toDomain();
                if (line.isPosted()) {
                    postedLines.add(line);
                    continue;
                }

                CostSource source = CostSource.fromSupplierBillLine(line.getId());
                Optional<CostItem> created = costItemPersistenceService.createLockedItem(
                        bill.getJobId(),
                        CostType.MATERIAL,
                        source,
                        bill.getSupplier(),
                        line.getDescription(),
                        line.getQuantity(),
                        line.getUnitCost(),
                        bill.costIncurredAt());

                CostItem item = created.isPresent()
                        ? created.get()
                        : costItemPersistenceService.findBySource(source)
                                .orElseThrow(() -> new IllegalStateException("Cost item vanished for source " + source.key()));
                if (created.isEmpty()) {
                    log.debug("Linking existing cost item {} to bill line {}", item.getId(), line.getId());
                }

                lineEntity.linkCostItem(item.getId());
                lineRepository.save(lineEntity);
                postedLines.add(line.linkCostItem(item.getId()));
                costItemIds.add(item.getId());
            }

            SupplierBill posted = bill.post(postedLines);
            entity.updateFromDomain(posted);
            billRepository.save(entity);

            outboxService.saveEvent(SupplierBillPostedEvent.from(posted, costItemIds));

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("jobId", posted.getJobId());
            meta.put("costItemIds", costItemIds);
            meta.put("subtotal", posted.getSubtotal());
            auditService.record("supplier_bill", billId, "supplier_bill.posted", AuditService.ROLE_ADMIN, actor, meta);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordPosting(POSTING_SOURCE, "success");
            metrics.recordLatency("supplier_bill_post", duration);
            log.info("Supplier bill posted: costItems={}, subtotal={}, duration={}ms",
                    costItemIds.size(), posted.getSubtotal(), duration);

            return posted;
        } catch (NotFoundException e) {
            metrics.recordPosting(POSTING_SOURCE, "not_found");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordPosting(POSTING_SOURCE, "error");
            log.error("Supplier bill posting failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.BILL_ID_MDC_KEY);
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }
}
