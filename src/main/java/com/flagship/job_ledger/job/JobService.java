package com.flagship.job_ledger.job;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.common.VatCalculator;
import com.flagship.job_ledger.config.LedgerProperties;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Job creation, budget lines, stages and checklist maintenance.
 *
 * Budget replacement locks the job row so it serialises with variation
 * settlement, which increments the same columns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobService {

    private final JobRepository jobRepository;
    private final JobStageRepository stageRepository;
    private final JobBudgetLineRepository budgetLineRepository;
    private final ChecklistItemRepository checklistItemRepository;
    private final AuditService auditService;
    private final LedgerProperties properties;

    @Transactional
    public Job createJob(NewJob newJob, String actor) {
        if (newJob.getClientName() == null || newJob.getClientName().isBlank()) {
            throw new IllegalArgumentException("Client name is required");
        }
        UUID jobId = UUID.randomUUID();
        List<JobBudgetLine> lines = toLines(jobId, newJob.getBudgetLines());
        BigDecimal vatRate = newJob.getQuoteVatRate() != null
                ? newJob.getQuoteVatRate()
                : properties.getVat().getDefaultRate();

        Job job = Job.create(jobId, newJob.getLegalEntityId(), newJob.getTitle(), newJob.getClientName().trim(),
                newJob.getClientEmail(), newJob.getQuoteVatRate(), budgetFor(lines, vatRate));

        JobEntity saved = jobRepository.save(JobEntity.fromDomain(job));
        lines.forEach(line -> budgetLineRepository.save(JobBudgetLineEntity.fromDomain(line)));

        int order = 0;
        for (String stageName : newJob.getStageNames()) {
            stageRepository.save(JobStageEntity.fromDomain(JobStage.create(jobId, stageName, order++)));
        }

        log.info("Job created: jobId={}, budgetSubtotal={}, stages={}",
                jobId, job.getBudgetSubtotal(), newJob.getStageNames().size());
        auditService.record("job", jobId, "job.created", AuditService.ROLE_ADMIN, actor,
                Map.of("budgetSubtotal", job.getBudgetSubtotal()));
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Job getJob(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(JobEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Job", jobId));
    }

    @Transactional(readOnly = true)
    public List<JobStage> listStages(UUID jobId) {
        requireJob(jobId);
        return stageRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                .map(JobStageEntity::toDomain)
                .toList();
    }

    @Transactional
    public JobStage addStage(UUID jobId, String name) {
        requireJob(jobId);
        int order = stageRepository.findByJobIdOrderBySortOrderAsc(jobId).size();
        return stageRepository.save(JobStageEntity.fromDomain(JobStage.create(jobId, name, order))).toDomain();
    }

    @Transactional(readOnly = true)
    public List<JobBudgetLine> listBudgetLines(UUID jobId) {
        requireJob(jobId);
        return budgetLineRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                .map(JobBudgetLineEntity::toDomain)
                .toList();
    }

    /**
     * Replaces every budget line and recomputes the budget snapshot from them.
     * Approved variation increments applied earlier are superseded by the new lines.
     */
    @Transactional
    public Job replaceBudgetLines(UUID jobId, List<BudgetLineInput> inputs, String actor) {
        List<JobBudgetLine> lines = toLines(jobId, inputs);
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, jobId.toString());
        try {
            JobEntity entity = jobRepository.findByIdForUpdate(jobId)
                    .orElseThrow(() -> NotFoundException.of("Job", jobId));
            Job job = entity.toDomain();

            budgetLineRepository.deleteAllForJob(jobId);
            lines.forEach(line -> budgetLineRepository.save(JobBudgetLineEntity.fromDomain(line)));

            BigDecimal vatRate = job.vatRateOr(properties.getVat().getDefaultRate());
            Job updated = job.withBudget(budgetFor(lines, vatRate));
            entity.replaceBudget(updated);
            jobRepository.save(entity);

            log.info("Budget lines replaced: lines={}, budgetSubtotal={}", lines.size(), updated.getBudgetSubtotal());
            auditService.record("job", jobId, "job.budget_replaced", AuditService.ROLE_ADMIN, actor,
                    Map.of("lines", lines.size(), "budgetSubtotal", updated.getBudgetSubtotal()));
            return entity.toDomain();
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<ChecklistItem> listChecklist(UUID jobId) {
        requireJob(jobId);
        return checklistItemRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                .map(ChecklistItemEntity::toDomain)
                .toList();
    }

    @Transactional
    public ChecklistItem addChecklistItem(UUID jobId, String title, boolean required) {
        requireJob(jobId);
        int order = (int) checklistItemRepository.countByJobId(jobId);
        ChecklistItem item = ChecklistItem.create(jobId, title, required, order);
        log.debug("Adding checklist item: jobId={}, title={}, required={}", jobId, item.getTitle(), required);
        return checklistItemRepository.save(ChecklistItemEntity.fromDomain(item)).toDomain();
    }

    @Transactional
    public ChecklistItem completeChecklistItem(UUID jobId, UUID itemId, String actor) {
        ChecklistItemEntity entity = checklistItemRepository.findById(itemId)
                .filter(found -> found.getJobId().equals(jobId))
                .orElseThrow(() -> NotFoundException.of("ChecklistItem", itemId));
        ChecklistItem item = entity.toDomain();
        if (item.isCompleted()) {
            return item;
        }
        ChecklistItem completed = item.complete(actor);
        entity.updateFromDomain(completed);
        checklistItemRepository.save(entity);
        auditService.record("job", jobId, "job.checklist_item_completed", AuditService.ROLE_ADMIN, actor,
                Map.of("itemId", itemId, "title", completed.getTitle()));
        return completed;
    }

    private void requireJob(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw NotFoundException.of("Job", jobId);
        }
    }

    private static List<JobBudgetLine> toLines(UUID jobId, List<BudgetLineInput> inputs) {
        List<JobBudgetLine> lines = new ArrayList<>();
        if (inputs == null) {
            return lines;
        }
        int order = 0;
        for (BudgetLineInput input : inputs) {
            lines.add(JobBudgetLine.create(jobId, input, order++));
        }
        return lines;
    }

    private static VatCalculator.Amounts budgetFor(List<JobBudgetLine> lines, BigDecimal vatRate) {
        BigDecimal subtotal = lines.stream()
                .map(JobBudgetLine::getTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return VatCalculator.amountsFor(subtotal, vatRate);
    }
}
