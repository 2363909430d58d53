package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.costing.dto.CostItemResponse;
import com.flagship.job_ledger.costing.dto.CreateCostItemRequest;
import com.flagship.job_ledger.costing.dto.UpdateCostItemRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Cost ledger endpoints and the job costing summary.
 *
 * Creating a cost item accepts an optional Idempotency-Key header: a repeated
 * key returns the item created the first time with 200 instead of 201.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CostItemController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final CostLedgerService costLedgerService;
    private final JobCostingService jobCostingService;

    @PostMapping("/jobs/{jobId}/cost-items")
    public ResponseEntity<CostItemResponse> addCostItem(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody CreateCostItemRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {

        CostItemCreation creation = costLedgerService.addCostItem(jobId, request.toNewCostItem(), idempotencyKey, actor);
        HttpStatus status = creation.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(CostItemResponse.from(creation.getItem()));
    }

    @GetMapping("/jobs/{jobId}/cost-items")
    public ResponseEntity<List<CostItemResponse>> listCostItems(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(costLedgerService.listCostItems(jobId).stream()
                .map(CostItemResponse::from)
                .toList());
    }

    @GetMapping("/cost-items/{id}")
    public ResponseEntity<CostItemResponse> getCostItem(@PathVariable("id") UUID id) {
        return costLedgerService.getCostItem(id)
            .map(item -> ResponseEntity.ok(CostItemResponse.from(item)))
            .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/cost-items/{id}")
    public ResponseEntity<CostItemResponse> updateCostItem(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateCostItemRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(CostItemResponse.from(costLedgerService.updateCostItem(id, request.toUpdate(), actor)));
    }

    @DeleteMapping("/cost-items/{id}")
    public ResponseEntity<Void> deleteCostItem(
            @PathVariable("id") UUID id,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        costLedgerService.deleteCostItem(id, actor);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/jobs/{jobId}/costing")
    public ResponseEntity<JobCostingSummary> getJobCosting(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(jobCostingService.getJobCosting(jobId));
    }
}
