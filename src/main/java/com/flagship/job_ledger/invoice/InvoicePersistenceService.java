package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.common.Money;
import com.flagship.job_ledger.common.VatCalculator;
import com.flagship.job_ledger.config.LedgerProperties;
import com.flagship.job_ledger.event.InvoiceCreatedEvent;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.job.JobEntity;
import com.flagship.job_ledger.job.JobRepository;
import com.flagship.job_ledger.job.JobStageEntity;
import com.flagship.job_ledger.job.JobStageRepository;
import com.flagship.job_ledger.numbering.LegalEntityNumberingService;
import com.flagship.job_ledger.outbox.OutboxService;
import com.flagship.job_ledger.variation.VariationEntity;
import com.flagship.job_ledger.variation.VariationRepository;
import com.flagship.job_ledger.variation.VariationStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Transactional side of invoice issuance.
 *
 * The job row is locked before any uniqueness check runs, so two requests for
 * the same FINAL, STAGE or VARIATION invoice on one job are serialised and the
 * second one finds the first one's invoice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoicePersistenceService {

    private final JobRepository jobRepository;
    private final JobStageRepository stageRepository;
    private final VariationRepository variationRepository;
    private final InvoiceRepository invoiceRepository;
    private final InvoiceVariationRepository invoiceVariationRepository;
    private final LegalEntityNumberingService numberingService;
    private final OutboxService outboxService;
    private final AuditService auditService;
    private final LedgerProperties properties;

    @Transactional
    public InvoiceCreation issue(CreateInvoiceCommand command, String actor) {
        Job job = jobRepository.findByIdForUpdate(command.getJobId())
                .map(JobEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Job", command.getJobId()));

        BigDecimal vatRate = command.getVatRate() != null
                ? command.getVatRate()
                : job.vatRateOr(properties.getVat().getDefaultRate());
        BigDecimal base = Money.round2(command.getSubtotal());

        return switch (command.getType()) {
            case FINAL -> existing(invoiceRepository.findFirstByJobIdAndTypeOrderByCreatedAtAsc(
                    job.getId(), InvoiceType.FINAL))
                    .orElseGet(() -> create(job, command, vatRate, VatCalculator.amountsFor(base, vatRate),
                            List.of(), actor));
            case DEPOSIT -> create(job, command, vatRate, VatCalculator.amountsFor(base, vatRate), List.of(), actor);
            case VARIATION -> issueVariationInvoice(job, command, actor);
            case STAGE -> issueStageInvoice(job, command, vatRate, base, actor);
        };
    }

    @Transactional(readOnly = true)
    public Optional<Invoice> findById(UUID invoiceId) {
        return invoiceRepository.findById(invoiceId).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Invoice> findByJob(UUID jobId) {
        return invoiceRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(this::toDomain)
                .toList();
    }

    private InvoiceCreation issueVariationInvoice(Job job, CreateInvoiceCommand command, String actor) {
        UUID variationId = command.getVariationId();
        VariationEntity variation = variationRepository.findById(variationId)
                .filter(v -> job.getId().equals(v.getJobId()))
                .orElseThrow(() -> NotFoundException.of("Variation", variationId));
        if (variation.getStatus() != VariationStatus.APPROVED) {
            throw new IllegalStateException(String.format(
                    "Variation %s is %s; only approved variations can be invoiced", variationId,
                    variation.getStatus()));
        }

        Optional<InvoiceCreation> billed = existing(invoiceRepository.findFirstByVariationIdOrderByCreatedAtAsc(variationId));
        if (billed.isEmpty()) {
            billed = existing(invoiceVariationRepository.findByVariationId(variationId)
                    .flatMap(link -> invoiceRepository.findById(link.getInvoiceId())));
        }
        if (billed.isPresent()) {
            return billed.get();
        }

        VatCalculator.Amounts amounts = new VatCalculator.Amounts(
                variation.getSubtotal(), variation.getVat(), variation.getTotal());
        return create(job, command, variation.getVatRate(), amounts, List.of(), actor);
    }

    private InvoiceCreation issueStageInvoice(Job job, CreateInvoiceCommand command, BigDecimal vatRate,
                                              BigDecimal base, String actor) {
        String stageName = command.getStageName().trim();
        Optional<InvoiceCreation> existing = existing(invoiceRepository
                .findFirstByJobIdAndTypeAndStageNameIgnoreCaseOrderByCreatedAtAsc(job.getId(), InvoiceType.STAGE,
                        stageName));
        if (existing.isPresent()) {
            return existing.get();
        }

        List<VariationEntity> rollUp = unbilledApprovedVariations(job.getId(), stageName);

        VatCalculator.Amounts amounts = VatCalculator.amountsFor(base, vatRate);
        for (VariationEntity variation : rollUp) {
            amounts = amounts.plus(new VatCalculator.Amounts(variation.getSubtotal(), variation.getVat(),
                    variation.getTotal()));
        }

        List<UUID> variationIds = rollUp.stream().map(VariationEntity::getId).toList();
        return create(job, command, vatRate, amounts, variationIds, actor);
    }

    /**
     * Approved variations on the job that no invoice has billed yet, limited
     * to the named stage (case-insensitive) when one is given.
     */
    private List<VariationEntity> unbilledApprovedVariations(UUID jobId, String stageName) {
        Set<UUID> billed = new HashSet<>(invoiceVariationRepository.findBilledVariationIdsForJob(jobId));
        billed.addAll(invoiceRepository.findReferencedVariationIdsForJob(jobId));

        Map<UUID, String> stageNames = stageRepository.findByJobIdOrderBySortOrderAsc(jobId).stream()
                .collect(Collectors.toMap(JobStageEntity::getId, JobStageEntity::getName));
        boolean anyStage = stageName == null || stageName.isBlank();

        return variationRepository.findByJobIdAndStatusOrderByCreatedAtAsc(jobId, VariationStatus.APPROVED).stream()
                .filter(v -> !billed.contains(v.getId()))
                .filter(v -> anyStage || stageName.equalsIgnoreCase(stageNames.get(v.getStageId())))
                .toList();
    }

    private InvoiceCreation create(Job job, CreateInvoiceCommand command, BigDecimal vatRate,
                                   VatCalculator.Amounts amounts, List<UUID> variationIds, String actor) {
        String number = numberingService.allocateInvoiceNumber(job.getLegalEntityId());
        String stageName = command.getStageName() != null ? command.getStageName().trim() : null;
        String clientName = job.getClientName() != null ? job.getClientName() : job.getTitle();

        Invoice invoice = Invoice.draft(job.getLegalEntityId(), job.getId(), command.getType(), stageName,
                command.getType() == InvoiceType.VARIATION ? command.getVariationId() : null,
                clientName, job.getClientEmail(), vatRate, amounts, number, variationIds);

        invoiceRepository.save(InvoiceEntity.fromDomain(invoice));
        for (UUID variationId : variationIds) {
            invoiceVariationRepository.save(new InvoiceVariationEntity(invoice.getId(), variationId));
        }

        outboxService.saveEvent(InvoiceCreatedEvent.from(invoice));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("jobId", job.getId());
        meta.put("type", invoice.getType().name());
        meta.put("stageName", invoice.getStageName());
        meta.put("variationId", invoice.getVariationId());
        meta.put("variationIds", variationIds);
        auditService.record("invoice", invoice.getId(), "invoice.created", AuditService.ROLE_ADMIN, actor, meta);

        log.info("Invoice created: invoiceId={}, number={}, type={}, total={}, variations={}",
                invoice.getId(), number, invoice.getType(), invoice.getTotal(), variationIds.size());
        return new InvoiceCreation(invoice, false);
    }

    private Optional<InvoiceCreation> existing(Optional<InvoiceEntity> entity) {
        return entity.map(e -> new InvoiceCreation(toDomain(e), true));
    }

    private Invoice toDomain(InvoiceEntity entity) {
        List<UUID> variationIds = invoiceVariationRepository.findByInvoiceIdOrderByCreatedAtAsc(entity.getId())
                .stream()
                .map(InvoiceVariationEntity::getVariationId)
                .toList();
        return entity.toDomain(variationIds);
    }
}
