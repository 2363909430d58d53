package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobBudgetLine;
import com.flagship.job_ledger.job.JobBudgetLineEntity;
import com.flagship.job_ledger.job.JobBudgetLineRepository;
import com.flagship.job_ledger.job.JobEntity;
import com.flagship.job_ledger.job.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Job costing read model.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobCostingService {

    private final JobRepository jobRepository;
    private final JobBudgetLineRepository budgetLineRepository;
    private final CostItemRepository costItemRepository;

    @Transactional(readOnly = true)
    public JobCostingSummary getJobCosting(UUID jobId) {
        JobEntity job = jobRepository.findById(jobId)
                .orElseThrow(() -> NotFoundException.of("Job", jobId));

        List<JobBudgetLine> lines = budgetLineRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                .map(JobBudgetLineEntity::toDomain)
                .toList();
        List<CostItem> items = costItemRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(CostItemEntity::toDomain)
                .toList();

        JobCostingSummary summary = JobFinancialsCalculator.compute(jobId, lines, job.getBudgetSubtotal(), items);
        log.debug("Job costing computed: jobId={}, budget={}, actual={}, forecast={}",
                jobId, summary.getBudgetSubtotal(), summary.getActualCost(), summary.getForecastCost());
        return summary;
    }
}
