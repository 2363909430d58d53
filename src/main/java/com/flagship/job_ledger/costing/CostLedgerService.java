package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Manual side of the cost ledger: add, edit, delete and list cost items.
 *
 * Inputs are validated here, before any transaction opens. Persistence and
 * the lock check happen in {@link CostItemPersistenceService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostLedgerService {

    private final CostItemPersistenceService persistenceService;
    private final CostItemIdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    /**
     * Adds a manual OPEN cost item. Manual entries may repeat; a repeated
     * idempotency key returns the item created for it the first time.
     *
     * @param idempotencyKey optional, scoped to the job
     */
    public CostItemCreation addCostItem(UUID jobId, NewCostItem input, String idempotencyKey, String actor) {
        input.validate();
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, jobId.toString());

        log.info("Adding cost item: type={}, quantity={}, unitCost={}, idempotencyKey={}",
                input.getType(), input.getQuantity(), input.getUnitCost(), idempotencyKey);

        try {
            String requestKey = idempotencyKey != null
                    ? CostItemIdempotencyService.scopedKey(jobId, idempotencyKey)
                    : null;

            if (requestKey != null) {
                Optional<CostItem> existing = findExisting(requestKey);
                if (existing.isPresent()) {
                    metrics.recordIdempotencyHit();
                    log.info("Request key already used, returning cost item {}", existing.get().getId());
                    return new CostItemCreation(existing.get(), true);
                }
                metrics.recordIdempotencyMiss();
            }

            CostItem saved;
            try {
                saved = persistenceService.insertManual(jobId, input, requestKey, actor);
            } catch (DataIntegrityViolationException e) {
                // concurrent request with the same key committed first
                if (requestKey == null) {
                    throw e;
                }
                CostItem winner = persistenceService.findByRequestKey(requestKey).orElseThrow(() -> e);
                metrics.recordIdempotencyHit();
                return new CostItemCreation(winner, true);
            }

            if (requestKey != null) {
                idempotencyService.remember(requestKey, saved.getId());
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordCostItem("add", "success");
            metrics.recordLatency("cost_item_add", duration);
            log.info("Cost item added: costItemId={}, totalCost={}, duration={}ms",
                    saved.getId(), saved.getTotalCost(), duration);

            return new CostItemCreation(saved, false);
        } catch (RuntimeException e) {
            metrics.recordCostItem("add", "error");
            log.error("Adding cost item failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }

    /**
     * @throws CostItemLockedException if the item is locked
     */
    public CostItem updateCostItem(UUID costItemId, CostItemUpdate update, String actor) {
        update.validate();
        try {
            CostItem updated = persistenceService.update(costItemId, update, actor);
            metrics.recordCostItem("update", "success");
            log.info("Cost item updated: costItemId={}, totalCost={}", costItemId, updated.getTotalCost());
            return updated;
        } catch (CostItemLockedException e) {
            metrics.recordCostItem("update", "locked");
            log.warn("Rejected update of locked cost item {}", costItemId);
            throw e;
        }
    }

    /**
     * @throws CostItemLockedException if the item is locked
     */
    public void deleteCostItem(UUID costItemId, String actor) {
        try {
            persistenceService.delete(costItemId, actor);
            metrics.recordCostItem("delete", "success");
            log.info("Cost item deleted: costItemId={}", costItemId);
        } catch (CostItemLockedException e) {
            metrics.recordCostItem("delete", "locked");
            log.warn("Rejected delete of locked cost item {}", costItemId);
            throw e;
        }
    }

    public List<CostItem> listCostItems(UUID jobId) {
        return persistenceService.findByJob(jobId);
    }

    public Optional<CostItem> getCostItem(UUID costItemId) {
        return persistenceService.findById(costItemId);
    }

    private Optional<CostItem> findExisting(String requestKey) {
        Optional<UUID> cachedId = idempotencyService.findCostItemId(requestKey);
        if (cachedId.isEmpty()) {
            return Optional.empty();
        }
        Optional<CostItem> item = persistenceService.findById(cachedId.get());
        if (item.isEmpty()) {
            idempotencyService.forget(requestKey);
        }
        return item;
    }
}
