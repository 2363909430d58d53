package com.flagship.job_ledger.costing;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobRepository;
import com.flagship.job_ledger.job.JobStageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional side of the cost ledger.
 *
 * Updates and deletes re-read the item under a row lock, so the lock check
 * and the write see the same committed state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostItemPersistenceService {

    private static final String ENTITY_TYPE = "cost_item";

    private final CostItemRepository costItemRepository;
    private final JobRepository jobRepository;
    private final JobStageRepository stageRepository;
    private final AuditService auditService;

    @Transactional
    public CostItem insertManual(UUID jobId, NewCostItem input, String requestKey, String actor) {
        if (!jobRepository.existsById(jobId)) {
            throw NotFoundException.of("Job", jobId);
        }
        if (input.getStageId() != null && stageRepository.findByIdAndJobId(input.getStageId(), jobId).isEmpty()) {
            throw NotFoundException.of("JobStage", input.getStageId());
        }

        CostItem item = CostItem.manual(jobId, input, requestKey);
        CostItem saved = costItemRepository.saveAndFlush(CostItemEntity.fromDomain(item)).toDomain();
        log.debug("Saved manual cost item {} with request key {}", saved.getId(), requestKey);

        auditService.record(ENTITY_TYPE, saved.getId(), "cost_item.created", AuditService.ROLE_ADMIN, actor,
                auditMeta(saved));
        return saved;
    }

    @Transactional
    public CostItem update(UUID costItemId, CostItemUpdate update, String actor) {
        CostItemEntity entity = costItemRepository.findByIdForUpdate(costItemId)
                .orElseThrow(() -> NotFoundException.of("CostItem", costItemId));

        CostItem updated = entity.toDomain().apply(update);
        entity.updateFromDomain(updated);
        CostItem saved = costItemRepository.save(entity).toDomain();

        auditService.record(ENTITY_TYPE, costItemId, "cost_item.updated", AuditService.ROLE_ADMIN, actor,
                auditMeta(saved));
        return saved;
    }

    @Transactional
    public void delete(UUID costItemId, String actor) {
        CostItemEntity entity = costItemRepository.findByIdForUpdate(costItemId)
                .orElseThrow(() -> NotFoundException.of("CostItem", costItemId));

        CostItem item = entity.toDomain();
        item.ensureMutable();
        costItemRepository.delete(entity);

        auditService.record(ENTITY_TYPE, costItemId, "cost_item.deleted", AuditService.ROLE_ADMIN, actor,
                auditMeta(item));
    }

    @Transactional(readOnly = true)
    public Optional<CostItem> findById(UUID costItemId) {
        return costItemRepository.findById(costItemId).map(CostItemEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<CostItem> findByRequestKey(String requestKey) {
        return costItemRepository.findByRequestKey(requestKey).map(CostItemEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<CostItem> findByJob(UUID jobId) {
        return costItemRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(CostItemEntity::toDomain)
                .toList();
    }

    /**
     * Looks up the item already posted for a source, inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CostItem> findBySource(CostSource source) {
        if (source.isManual()) {
            return Optional.empty();
        }
        return costItemRepository.findBySourceKey(source.uniqueKey()).map(CostItemEntity::toDomain);
    }

    /**
     * Creates a LOCKED item for a sourced posting, inside the caller's transaction.
     * The unique {@code source_key} column rejects a second item for the same source.
     *
     * @return the new item, or empty when the source already has one
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<CostItem> createLockedItem(UUID jobId, CostType type, CostSource source, String supplier,
                                               String description, BigDecimal quantity, BigDecimal unitCost,
                                               Instant incurredAt) {
        if (costItemRepository.countBySourceKey(source.uniqueKey()) > 0) {
            log.debug("Cost item already exists for source {}", source.key());
            return Optional.empty();
        }
        CostItem item = CostItem.locked(jobId, type, source, supplier, description, quantity, unitCost, incurredAt);
        CostItem saved = costItemRepository.save(CostItemEntity.fromDomain(item)).toDomain();
        log.debug("Created locked cost item {} for source {}", saved.getId(), source.key());
        return Optional.of(saved);
    }

    private static Map<String, Object> auditMeta(CostItem item) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("jobId", item.getJobId());
        meta.put("type", item.getType().name());
        meta.put("totalCost", item.getTotalCost());
        meta.put("source", item.getSource().key());
        return meta;
    }
}
