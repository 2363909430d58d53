package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.invoice.dto.CreateInvoiceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceIssuanceService invoiceService;

    /**
     * 201 for a new invoice, 200 when the invoice already existed.
     */
    @PostMapping("/jobs/{jobId}/invoices")
    public ResponseEntity<Invoice> createInvoice(
            @PathVariable("jobId") UUID jobId,
            @Valid @RequestBody CreateInvoiceRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        InvoiceCreation result = invoiceService.createInvoiceForJob(request.toCommand(jobId), actor);
        HttpStatus status = result.isExisting() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result.getInvoice());
    }

    @GetMapping("/jobs/{jobId}/invoices")
    public ResponseEntity<List<Invoice>> listInvoices(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(invoiceService.listInvoices(jobId));
    }

    @GetMapping("/invoices/{id}")
    public ResponseEntity<Invoice> getInvoice(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(invoiceService.getInvoice(id));
    }

    @GetMapping("/invoices/{id}/attachments")
    public ResponseEntity<List<InvoiceAttachment>> listAttachments(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(invoiceService.listAttachments(id));
    }
}
