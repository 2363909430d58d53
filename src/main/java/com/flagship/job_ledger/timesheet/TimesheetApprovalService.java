package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.common.Money;
import com.flagship.job_ledger.costing.CostItem;
import com.flagship.job_ledger.costing.CostItemPersistenceService;
import com.flagship.job_ledger.costing.CostSource;
import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.event.TimesheetApprovedEvent;
import com.flagship.job_ledger.event.TimesheetRejectedEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import com.flagship.job_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Approves and rejects timesheets, posting labour cost on approval.
 *
 * Key principles:
 * - The timesheet row is locked first, so concurrent approvals serialise and
 *   the loser sees APPROVED and returns without posting
 * - Each time entry posts at most one LABOUR item (source key {@code timesheet:<entryId>})
 * - Status change, entry locks, cost items and the outbox event commit together
 * - The audit record is written after commit
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimesheetApprovalService {

    private static final String POSTING_SOURCE = "timesheet";

    private final TimesheetRepository timesheetRepository;
    private final TimeEntryRepository timeEntryRepository;
    private final EngineerRepository engineerRepository;
    private final LabourRateResolver rateResolver;
    private final CostItemPersistenceService costItemPersistenceService;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerMetrics metrics;

    /**
     * Approves a timesheet and posts one locked labour cost item per finished entry.
     * Approving an already approved timesheet returns it unchanged.
     *
     * @throws NotFoundException if the timesheet does not exist
     * @throws IllegalStateException if the timesheet was rejected
     */
    @Transactional
    public Timesheet approveTimesheet(UUID timesheetId, String approver) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TIMESHEET_ID_MDC_KEY, timesheetId.toString());

        log.info("Attempting to approve timesheet: approver={}", approver);

        try {
            TimesheetEntity entity = timesheetRepository.findByIdForUpdate(timesheetId)
                    .orElseThrow(() -> NotFoundException.of("Timesheet", timesheetId));
            Timesheet timesheet = entity.toDomain();

            if (timesheet.isApproved()) {
                log.info("Timesheet already approved by {} at {}", timesheet.getApprovedBy(), timesheet.getApprovedAt());
                metrics.recordPosting(POSTING_SOURCE, "already_approved");
                return timesheet;
            }

            Timesheet approved = timesheet.approve(approver);
            entity.updateFromDomain(approved);
            timesheetRepository.save(entity);

            Instant lockedAt = approved.getApprovedAt();
            Map<UUID, Engineer> engineers = new HashMap<>();
            List<UUID> costItemIds = new ArrayList<>();
            BigDecimal totalHours = BigDecimal.ZERO;
            BigDecimal totalCost = BigDecimal.ZERO;

            for (TimeEntryEntity entryEntity : timeEntryRepository.findByTimesheetIdOrderByStartedAtAsc(timesheetId)) {
                TimeEntry entry = entryEntity.toDomain();
                entryEntity.updateStatusFromDomain(entry.lock(lockedAt));
                timeEntryRepository.save(entryEntity);

                BigDecimal hours = entry.workedHours();
                if (hours.signum() <= 0) {
                    log.debug("Skipping time entry {} with no worked hours", entry.getId());
                    continue;
                }

                Engineer engineer = engineers.computeIfAbsent(entry.getEngineerId(), this::loadEngineer);
                BigDecimal rate = rateResolver.costRateFor(engineer);

                Optional<CostItem> posted = costItemPersistenceService.createLockedItem(
                        entry.getJobId(),
                        CostType.LABOUR,
                        CostSource.fromTimesheet(entry.getId()),
                        null,
                        "Labour (" + engineer.displayName() + ")",
                        hours,
                        rate,
                        entry.getStartedAt());

                if (posted.isPresent()) {
                    costItemIds.add(posted.get().getId());
                    totalHours = totalHours.add(hours);
                    totalCost = totalCost.add(posted.get().getTotalCost());
                }
            }

            outboxService.saveEvent(TimesheetApprovedEvent.from(approved, costItemIds, totalHours, Money.round2(totalCost)));

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("costItemIds", costItemIds);
            meta.put("hours", totalHours);
            auditService.record("timesheet", timesheetId, "timesheet.approved", AuditService.ROLE_ADMIN, approver, meta);

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordPosting(POSTING_SOURCE, "success");
            metrics.recordLatency("timesheet_approve", duration);
            log.info("Timesheet approved: costItems={}, hours={}, cost={}, duration={}ms",
                    costItemIds.size(), totalHours, Money.round2(totalCost), duration);

            return approved;
        } catch (NotFoundException e) {
            metrics.recordPosting(POSTING_SOURCE, "not_found");
            throw e;
        } catch (IllegalStateException e) {
            metrics.recordPosting(POSTING_SOURCE, "invalid_status");
            log.warn("Timesheet approval rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordPosting(POSTING_SOURCE, "error");
            log.error("Timesheet approval failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TIMESHEET_ID_MDC_KEY);
        }
    }

    /**
     * Rejects a timesheet and unlocks its entries. No cost is posted.
     * Rejecting an already rejected timesheet returns it unchanged.
     *
     * @throws IllegalStateException if the timesheet was approved
     */
    @Transactional
    public Timesheet rejectTimesheet(UUID timesheetId, String approver, String reason) {
        MDC.put(CorrelationContext.TIMESHEET_ID_MDC_KEY, timesheetId.toString());
        try {
            TimesheetEntity entity = timesheetRepository.findByIdForUpdate(timesheetId)
                    .orElseThrow(() -> NotFoundException.of("Timesheet", timesheetId));
            Timesheet timesheet = entity.toDomain();

            if (timesheet.isRejected()) {
                log.info("Timesheet already rejected");
                return timesheet;
            }

            Timesheet rejected = timesheet.reject(approver, reason);
            entity.updateFromDomain(rejected);
            timesheetRepository.save(entity);

            for (TimeEntryEntity entryEntity : timeEntryRepository.findByTimesheetIdOrderByStartedAtAsc(timesheetId)) {
                entryEntity.updateStatusFromDomain(entryEntity.toDomain().unlock());
                timeEntryRepository.save(entryEntity);
            }

            outboxService.saveEvent(TimesheetRejectedEvent.from(rejected));
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("reason", reason);
            auditService.record("timesheet", timesheetId, "timesheet.rejected", AuditService.ROLE_ADMIN, approver, meta);

            metrics.recordPosting(POSTING_SOURCE, "rejected");
            log.info("Timesheet rejected by {}", approver);
            return rejected;
        } finally {
            MDC.remove(CorrelationContext.TIMESHEET_ID_MDC_KEY);
        }
    }

    private Engineer loadEngineer(UUID engineerId) {
        return engineerRepository.findById(engineerId)
                .map(EngineerEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Engineer", engineerId));
    }
}
