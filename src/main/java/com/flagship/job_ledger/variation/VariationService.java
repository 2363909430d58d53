package com.flagship.job_ledger.variation;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.config.LedgerProperties;
import com.flagship.job_ledger.event.VariationSentEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.job.JobEntity;
import com.flagship.job_ledger.job.JobRepository;
import com.flagship.job_ledger.job.JobStageRepository;
import com.flagship.job_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Variation authoring: create, edit while draft, send to the client.
 * Client decisions go through {@link VariationSettlementService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VariationService {

    private final VariationRepository variationRepository;
    private final VariationItemRepository itemRepository;
    private final JobRepository jobRepository;
    private final JobStageRepository stageRepository;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    @Transactional
    public Variation createVariation(NewVariation input, String actor) {
        Job job = jobRepository.findById(input.getJobId())
                .map(JobEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Job", input.getJobId()));
        if (input.getStageId() != null && stageRepository.findByIdAndJobId(input.getStageId(), job.getId()).isEmpty()) {
            throw NotFoundException.of("JobStage", input.getStageId());
        }
        BigDecimal vatRate = input.getVatRate() != null
                ? input.getVatRate()
                : job.vatRateOr(properties.getVat().getDefaultRate());

        UUID variationId = UUID.randomUUID();
        List<VariationItem> items = toItems(variationId, input.getItems());
        Variation variation = Variation.create(variationId, job.getId(), input.getStageId(), input.getTitle(),
                input.getReason(), vatRate, items);

        VariationEntity saved = variationRepository.save(VariationEntity.fromDomain(variation));
        items.forEach(item -> itemRepository.save(VariationItemEntity.fromDomain(item)));

        log.info("Variation created: variationId={}, jobId={}, subtotal={}, vat={}",
                variationId, job.getId(), variation.getSubtotal(), variation.getVat());
        auditService.record("variation", variationId, "variation.created", AuditService.ROLE_ADMIN, actor,
                Map.of("jobId", job.getId(), "total", variation.getTotal()));
        return saved.toDomain(items);
    }

    /**
     * Edits a draft. Null arguments keep the current value; a non-null item list
     * replaces all items.
     *
     * @throws IllegalStateException unless the variation is a draft
     */
    @Transactional
    public Variation updateVariationDraft(UUID variationId, String title, String reason, BigDecimal vatRate,
                                          List<VariationItemInput> itemInputs) {
        VariationEntity entity = variationRepository.findByIdForUpdate(variationId)
                .orElseThrow(() -> NotFoundException.of("Variation", variationId));
        Variation current = entity.toDomain(itemsOf(variationId));

        List<VariationItem> newItems = itemInputs != null ? toItems(variationId, itemInputs) : null;
        Variation updated = current.withDraftChanges(title, reason, vatRate, newItems);

        if (newItems != null) {
            itemRepository.deleteAllForVariation(variationId);
            newItems.forEach(item -> itemRepository.save(VariationItemEntity.fromDomain(item)));
        }
        entity.updateFromDomain(updated);
        variationRepository.save(entity);

        log.info("Variation draft updated: variationId={}, subtotal={}", variationId, updated.getSubtotal());
        return updated;
    }

    /**
     * @throws IllegalStateException if the variation has been decided
     */
    @Transactional
    public Variation sendVariation(UUID variationId, String actor) {
        VariationEntity entity = variationRepository.findByIdForUpdate(variationId)
                .orElseThrow(() -> NotFoundException.of("Variation", variationId));
        Variation current = entity.toDomain(itemsOf(variationId));

        Variation sent = current.send();
        if (sent == current) {
            log.info("Variation {} already sent", variationId);
            return current;
        }
        entity.updateFromDomain(sent);
        variationRepository.save(entity);

        outboxService.saveEvent(VariationSentEvent.from(sent));
        auditService.record("variation", variationId, "variation.sent", AuditService.ROLE_ADMIN, actor,
                Map.of("total", sent.getTotal()));
        log.info("Variation sent: variationId={}", variationId);
        return sent;
    }

    @Transactional(readOnly = true)
    public Variation getVariation(UUID variationId) {
        return variationRepository.findById(variationId)
                .map(entity -> entity.toDomain(itemsOf(variationId)))
                .orElseThrow(() -> NotFoundException.of("Variation", variationId));
    }

    @Transactional(readOnly = true)
    public Variation getVariationByToken(String token) {
        return variationRepository.findByToken(token)
                .map(entity -> entity.toDomain(itemsOf(entity.getId())))
                .orElseThrow(() -> new NotFoundException("Variation", "token"));
    }

    @Transactional(readOnly = true)
    public List<Variation> listVariations(UUID jobId) {
        return variationRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(entity -> entity.toDomain(itemsOf(entity.getId())))
                .toList();
    }

    private List<VariationItem> itemsOf(UUID variationId) {
        return itemRepository.findByVariationIdOrderBySortOrderAsc(variationId).stream()
                .map(VariationItemEntity::toDomain)
                .toList();
    }

    private static List<VariationItem> toItems(UUID variationId, List<VariationItemInput> inputs) {
        List<VariationItem> items = new ArrayList<>();
        if (inputs == null) {
            return items;
        }
        int order = 0;
        for (VariationItemInput input : inputs) {
            items.add(VariationItem.create(variationId, input, order++));
        }
        return items;
    }
}
