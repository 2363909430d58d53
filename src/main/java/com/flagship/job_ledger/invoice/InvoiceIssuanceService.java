package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.observability.CorrelationContext;
import com.flagship.job_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Raises client invoices for a job without double-billing.
 *
 * Key principles:
 * - One FINAL invoice per job, one STAGE invoice per stage name, one invoice per variation
 * - A repeated request returns the invoice that already exists
 * - Approved variations are billed exactly once, either on their own or rolled into a stage invoice
 * - Certificates are attached after the invoice commits; an attachment failure never undoes the invoice
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceIssuanceService {

    private final InvoicePersistenceService persistenceService;
    private final InvoiceAttachmentService attachmentService;
    private final LedgerMetrics metrics;

    /**
     * @throws NotFoundException if the job, or a VARIATION invoice's variation, does not exist
     * @throws IllegalStateException if a VARIATION invoice names a variation that is not approved
     */
    public InvoiceCreation createInvoiceForJob(CreateInvoiceCommand command, String actor) {
        command.validate();
        long startTime = System.currentTimeMillis();
        String typeTag = command.getType().name().toLowerCase();
        MDC.put(CorrelationContext.JOB_ID_MDC_KEY, command.getJobId().toString());

        log.info("Creating invoice: type={}, stageName={}, variationId={}, subtotal={}",
                command.getType(), command.getStageName(), command.getVariationId(), command.getSubtotal());

        try {
            InvoiceCreation result = persistenceService.issue(command, actor);

            if (result.isExisting()) {
                metrics.recordInvoice(typeTag, "existing");
                log.info("Invoice already exists, returning {}", result.getInvoice().getId());
                return result;
            }

            Invoice invoice = result.getInvoice();
            if (invoice.isCompletionInvoice()) {
                attachCertificatesQuietly(invoice);
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordInvoice(typeTag, "created");
            metrics.recordLatency("invoice_create", duration);
            log.info("Invoice issued: invoiceId={}, number={}, total={}, duration={}ms",
                    invoice.getId(), invoice.getInvoiceNumber(), invoice.getTotal(), duration);
            return result;
        } catch (NotFoundException e) {
            metrics.recordInvoice(typeTag, "not_found");
            throw e;
        } catch (RuntimeException e) {
            metrics.recordInvoice(typeTag, "error");
            log.error("Invoice creation failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.JOB_ID_MDC_KEY);
        }
    }

    public Invoice getInvoice(UUID invoiceId) {
        return persistenceService.findById(invoiceId)
                .orElseThrow(() -> NotFoundException.of("Invoice", invoiceId));
    }

    public List<Invoice> listInvoices(UUID jobId) {
        return persistenceService.findByJob(jobId);
    }

    public List<InvoiceAttachment> listAttachments(UUID invoiceId) {
        getInvoice(invoiceId);
        return attachmentService.listAttachments(invoiceId);
    }

    private void attachCertificatesQuietly(Invoice invoice) {
        try {
            attachmentService.attachCertificates(invoice);
        } catch (RuntimeException e) {
            log.warn("Certificate attachment failed, invoice kept: invoiceId={}, error={}",
                    invoice.getId(), e.getMessage());
        }
    }
}
