package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.event.VariationDecidedEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobRepository;
import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import com.flagship.job_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies client decisions on variations and settles approved ones into the job budget.
 *
 * Key principles:
 * - The variation row is locked before its status is read, so of two concurrent
 *   decisions exactly one sees a pending variation; the other returns the
 *   winner's state without side effects
 * - The budget increment is a single {@code x = x + delta} statement, so approvals
 *   of different variations on one job never overwrite each other
 * - Decision, budget increment and outbox event commit together; audit follows the commit
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariationSettlementService {

    private static final String DEFAULT_DECIDER = "client";

    private final VariationRepository variationRepository;
    private final VariationItemRepository itemRepository;
    private final JobRepository jobRepository;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerMetrics metrics;

    /**
     * Approves or rejects the variation behind a client token. Deciding an
     * already decided variation returns it unchanged.
     *
     * @throws NotFoundException if no variation has this token
     */
    @Transactional
    public Variation decideVariationByToken(String token, VariationDecision decision) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Variation token is required");
        }
        if (decision == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        long startTime = System.currentTimeMillis();
        String decisionTag = decision.name().toLowerCase();

        try {
            VariationEntity entity = variationRepository.findForUpdateByToken(token)
                    .orElseThrow(() -> new NotFoundException("Variation", "token"));
            MDC.put(CorrelationContext.VARIATION_ID_MDC_KEY, entity.getId().toString());

            List<VariationItem> items = itemRepository.findByVariationIdOrderBySortOrderAsc(entity.getId()).stream()
                    .map(VariationItemEntity::toDomain)
                    .toList();
            Variation variation = entity.toDomain(items);

            if (!variation.isPending()) {
                log.info("Variation already {}, returning current state", variation.getStatus());
                metrics.recordVariationDecision(decisionTag, "already_decided");
                return variation;
            }

            String decidedBy = variation.getJobId() != null
                    ? jobRepository.findClientEmail(variation.getJobId()).orElse(DEFAULT_DECIDER)
                    : DEFAULT_DECIDER;

            Variation decided = variation.decide(decision, decidedBy);
            entity.updateFromDomain(decided);
            variationRepository.save(entity);

            boolean budgetApplied = false;
            if (decided.isApproved() && decided.getJobId() != null) {
                int updated = jobRepository.incrementBudget(decided.getJobId(), decided.getSubtotal(),
                        decided.getVat(), decided.getTotal(), Instant.now());
                if (updated != 1) {
                    throw new IllegalStateException("Job " + decided.getJobId() + " not found for budget settlement");
                }
                budgetApplied = true;
                log.debug("Job budget incremented: jobId={}, subtotal={}, vat={}, total={}",
                        decided.getJobId(), decided.getSubtotal(), decided.getVat(), decided.getTotal());
            }

            outboxService.saveEvent(VariationDecidedEvent.from(decided, budgetApplied));

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("jobId", decided.getJobId());
            meta.put("subtotal", decided.getSubtotal());
            meta.put("vat", decided.getVat());
            meta.put("total", decided.getTotal());
            meta.put("budgetApplied", budgetApplied);
            String action = decided.isApproved() ? "variation.approved" : "variation.rejected";
            auditService.record("variation", decided.getId(), action, AuditService.ROLE_CLIENT, decidedBy, meta);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordVariationDecision(decisionTag, "success");
            metrics.recordLatency("variation_decide", duration);
            log.info("Variation {}: budgetApplied={}, total={}, duration={}ms",
                    decided.getStatus(), budgetApplied, decided.getTotal(), duration);

            return decided;
        } catch (NotFoundException e) {
            metrics.recordVariationDecision(decisionTag, "not_found");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordVariationDecision(decisionTag, "error");
            log.error("Variation decision failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.VARIATION_ID_MDC_KEY);
        }
    }
}
