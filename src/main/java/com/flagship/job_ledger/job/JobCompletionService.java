package com.flagship.job_ledger.job;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.event.JobCompletedEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import com.flagship.job_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Completes jobs behind the required-checklist gate.
 *
 * An admin may complete a job with pending required items by giving a reason;
 * the override is audited separately from the completion itself.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobCompletionService {

    private final JobRepository jobRepository;
    private final ChecklistItemRepository checklistItemRepository;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerMetrics metrics;

    /**
     * @param override null for a normal completion
     * @throws ChecklistIncompleteException if required items are pending and no override is given
     * @throws IllegalArgumentException if pending items are overridden by a non-admin or without a reason;
     *         an override on a job with nothing pending is ignored
     */
    @Transactional
    public Job completeJob(UUID jobId, String actor, CompletionOverride override) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, jobId.toString());

        log.info("Attempting to complete job: actor={}, override={}", actor, override != null);

        try {
            JobEntity entity = jobRepository.findByIdForUpdate(jobId)
                    .orElseThrow(() -> NotFoundException.of("Job", jobId));
            Job job = entity.toDomain();

            if (job.isCompleted()) {
                log.info("Job already completed at {}", job.getCompletedAt());
                metrics.recordJobCompletion("already_completed");
                return job;
            }

            List<ChecklistItem> incomplete = checklistItemRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                    .map(ChecklistItemEntity::toDomain)
                    .filter(ChecklistItem::blocksCompletion)
                    .toList();

            boolean overridden = false;
            if (!incomplete.isEmpty()) {
                if (override == null) {
                    log.warn("Job completion blocked: {} required checklist item(s) incomplete", incomplete.size());
                    metrics.recordJobCompletion("blocked");
                    throw new ChecklistIncompleteException(jobId, incomplete);
                }
                validateOverride(override);
                overridden = true;
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("reason", override.getReason().trim());
                meta.put("actor", actor);
                meta.put("incompleteItemIds", incomplete.stream().map(ChecklistItem::getId).toList());
                auditService.record("job", jobId, "job.completion_override", override.getActorRole(), actor, meta);
                log.warn("Checklist overridden by {}: {} item(s) incomplete", actor, incomplete.size());
            }

            Job completed = job.complete();
            entity.updateStatusFromDomain(completed);
            jobRepository.save(entity);

            outboxService.saveEvent(JobCompletedEvent.from(completed, actor, overridden));
            auditService.record("job", jobId, "job.completed", AuditService.ROLE_ADMIN, actor,
                    Map.of("checklistOverridden", overridden));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordJobCompletion(overridden ? "overridden" : "success");
            metrics.recordLatency("job_complete", duration);
            log.info("Job completed: overridden={}, duration={}ms", overridden, duration);

            return completed;
        } catch (ChecklistIncompleteException | NotFoundException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            metrics.recordJobCompletion("override_rejected");
            log.warn("Checklist override rejected: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metrics.recordJobCompletion("error");
            log.error("Job completion failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }

    private static void validateOverride(CompletionOverride override) {
        if (!AuditService.ROLE_ADMIN.equals(override.getActorRole())) {
            throw new IllegalArgumentException("Only an admin may override the completion checklist");
        }
        if (override.getReason() == null || override.getReason().isBlank()) {
            throw new IllegalArgumentException("An override reason is required");
        }
    }
}
