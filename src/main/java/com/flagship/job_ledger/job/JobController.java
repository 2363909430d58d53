package com.flagship.job_ledger.job;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.job.dto.BudgetLineRequest;
import com.flagship.job_ledger.job.dto.ChecklistItemRequest;
import com.flagship.job_ledger.job.dto.CompleteJobRequest;
import com.flagship.job_ledger.job.dto.CreateJobRequest;
import com.flagship.job_ledger.job.dto.ReplaceBudgetLinesRequest;
import com.flagship.job_ledger.job.dto.StageRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobService jobService;
    private final JobCompletionService completionService;

    @PostMapping
    public ResponseEntity<Job> createJob(
            @Valid @RequestBody CreateJobRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {

        NewJob.NewJobBuilder builder = NewJob.builder()
                .legalEntityId(request.getLegalEntityId())
                .title(request.getTitle())
                .clientName(request.getClientName())
                .clientEmail(request.getClientEmail())
                .quoteVatRate(request.getQuoteVatRate());
        if (request.getBudgetLines() != null) {
            request.getBudgetLines().forEach(line -> builder.budgetLine(line.toInput()));
        }
        if (request.getStages() != null) {
            request.getStages().forEach(builder::stageName);
        }

        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.createJob(builder.build(), actor));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<Job> getJob(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobService.getJob(jobId));
    }

    @GetMapping("/{jobId}/stages")
    public ResponseEntity<List<JobStage>> listStages(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobService.listStages(jobId));
    }

    @PostMapping("/{jobId}/stages")
    public ResponseEntity<JobStage> addStage(@PathVariable("jobId") UUID jobId,
                                             @Valid @RequestBody StageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(jobService.addStage(jobId, request.getName()));
    }

    @GetMapping("/{jobId}/budget-lines")
    public ResponseEntity<List<JobBudgetLine>> listBudgetLines(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobService.listBudgetLines(jobId));
    }

    @PutMapping("/{jobId}/budget-lines")
    public ResponseEntity<Job> replaceBudgetLines(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody ReplaceBudgetLinesRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        List<BudgetLineInput> lines = request.getLines().stream().map(BudgetLineRequest::toInput).toList();
        return ResponseEntity.ok(jobService.replaceBudgetLines(jobId, lines, actor));
    }

    @GetMapping("/{jobId}/checklist")
    public ResponseEntity<List<ChecklistItem>> listChecklist(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobService.listChecklist(jobId));
    }

    @PostMapping("/{jobId}/checklist")
    public ResponseEntity<ChecklistItem> addChecklistItem(@PathVariable("jobId") UUID jobId,
                                                          @Valid @RequestBody ChecklistItemRequest request) {
        boolean required = request.getRequired() == null || request.getRequired();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(jobService.addChecklistItem(jobId, request.getTitle(), required));
    }

    @PostMapping("/{jobId}/checklist/{itemId}/complete")
    public ResponseEntity<ChecklistItem> completeChecklistItem(
            @PathVariable("jobId") UUID jobId,
            @PathVariable("itemId") UUID itemId,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(jobService.completeChecklistItem(jobId, itemId, actor));
    }

    /**
     * Completes the job. With an override reason in the body, pending required
     * checklist items are bypassed, which only an admin may do.
     */
    @PostMapping("/{jobId}/complete")
    public ResponseEntity<Job> completeJob(
            @PathVariable("jobId") UUID jobId,
            @RequestBody(required = false) CompleteJobRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor,
            @RequestHeader(value = ActorHeaders.ACTOR_ROLE, defaultValue = ActorHeaders.DEFAULT_ROLE) String role) {

        CompletionOverride override = null;
        if (request != null && request.getOverrideReason() != null) {
            override = new CompletionOverride(role, request.getOverrideReason());
        }
        return ResponseEntity.ok(completionService.completeJob(jobId, actor, override));
    }
}
