package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.variation.dto.CreateVariationRequest;
import com.flagship.job_ledger.variation.dto.DecisionRequest;
import com.flagship.job_ledger.variation.dto.UpdateVariationRequest;
import com.flagship.job_ledger.variation.dto.VariationItemRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
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
 * Admin variation endpoints plus the client's token-addressed decision endpoint.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class VariationController {

    private final VariationService variationService;
    private final VariationSettlementService settlementService;

    @PostMapping("/jobs/{jobId}/variations")
    public ResponseEntity<Variation> createVariation(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody CreateVariationRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {

        NewVariation.NewVariationBuilder builder = NewVariation.builder()
                .jobId(jobId)
                .stageId(request.getStageId())
                .title(request.getTitle())
                .reason(request.getReason())
                .vatRate(request.getVatRate());
        if (request.getItems() != null) {
            request.getItems().forEach(item -> builder.item(item.toInput()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(variationService.createVariation(builder.build(), actor));
    }

    @GetMapping("/jobs/{jobId}/variations")
    public ResponseEntity<List<Variation>> listVariations(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(variationService.listVariations(jobId));
    }

    @GetMapping("/variations/{id}")
    public ResponseEntity<Variation> getVariation(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(variationService.getVariation(id));
    }

    @PatchMapping("/variations/{id}")
    public ResponseEntity<Variation> updateVariation(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody UpdateVariationRequest request) {
        List<VariationItemInput> items = request.getItems() == null
                ? null
                : request.getItems().stream().map(VariationItemRequest::toInput).toList();
        return ResponseEntity.ok(variationService.updateVariationDraft(
                id, request.getTitle(), request.getReason(), request.getVatRate(), items));
    }

    @PostMapping("/variations/{id}/send")
    public ResponseEntity<Variation> sendVariation(
            @PathVariable("id") UUID id,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(variationService.sendVariation(id, actor));
    }

    @GetMapping("/client/variations/{token}")
    public ResponseEntity<Variation> getVariationByToken(@PathVariable("token") String token) {
        return ResponseEntity.ok(variationService.getVariationByToken(token));
    }

    @PostMapping("/client/variations/{token}/decision")
    public ResponseEntity<Variation> decide(@PathVariable("token") String token,
                                            @Valid @RequestBody DecisionRequest request) {
        return ResponseEntity.ok(settlementService.decideVariationByToken(token, request.getDecision()));
    }
}
