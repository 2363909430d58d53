package com.flagship.job_ledger.invoice;

import com.flagship.job_ledger.LedgerIntegrationTestSupport;
import com.flagship.job_ledger.audit.AuditEvent;
import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.certificate.Certificate;
import com.flagship.job_ledger.certificate.CertificateService;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.Job;
import com.flagship.job_ledger.job.JobStage;
import com.flagship.job_ledger.numbering.LegalEntityNumberingService;
import com.flagship.job_ledger.variation.NewVariation;
import com.flagship.job_ledger.variation.Variation;
import com.flagship.job_ledger.variation.VariationDecision;
import com.flagship.job_ledger.variation.VariationItemInput;
import com.flagship.job_ledger.variation.VariationService;
import com.flagship.job_ledger.variation.VariationSettlementService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invoice issuance: one final invoice per job, one stage invoice per stage
 * name, every approved variation billed once.
 */
class InvoiceIssuanceServiceTest extends LedgerIntegrationTestSupport {

    @Autowired
    private InvoiceIssuanceService invoiceService;

    @Autowired
    private LegalEntityNumberingService numberingService;

    @Autowired
    private VariationService variationService;

    @Autowired
    private VariationSettlementService settlementService;

    @Autowired
    private CertificateService certificateService;

    @Autowired
    private AuditService auditService;

    private Job job;

    @BeforeEach
    void setUp() {
        UUID legalEntityId = numberingService.createLegalEntity("Sparks Ltd", "SPK-", "SPC-");
        job = createJob(legalEntityId, "80000", "Foundation", "Framing", "Completion");
    }

    private InvoiceCreation stage(String stageName, String subtotal) {
        return invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                .jobId(job.getId())
                .type(InvoiceType.STAGE)
                .stageName(stageName)
                .subtotal(new BigDecimal(subtotal))
                .build(), "test-admin");
    }

    private InvoiceCreation fin(String subtotal) {
        return invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                .jobId(job.getId())
                .type(InvoiceType.FINAL)
                .subtotal(new BigDecimal(subtotal))
                .build(), "test-admin");
    }

    private InvoiceCreation forVariation(UUID variationId) {
        return invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                .jobId(job.getId())
                .type(InvoiceType.VARIATION)
                .variationId(variationId)
                .build(), "test-admin");
    }

    private JobStage stageNamed(String name) {
        return jobService.listStages(job.getId()).stream()
                .filter(stage -> stage.getName().equals(name))
                .findFirst()
                .orElseThrow();
    }

    private Variation variation(UUID stageId, String subtotal) {
        return variationService.createVariation(NewVariation.builder()
                .jobId(job.getId())
                .stageId(stageId)
                .title("Variation " + subtotal)
                .vatRate(new BigDecimal("0.2"))
                .item(new VariationItemInput("Extra", BigDecimal.ONE, new BigDecimal(subtotal)))
                .build(), "test-admin");
    }

    private Variation approvedVariation(UUID stageId, String subtotal) {
        Variation variation = variation(stageId, subtotal);
        return settlementService.decideVariationByToken(variation.getToken(), VariationDecision.APPROVE);
    }

    @Nested
    @DisplayName("Stage invoices")
    class StageInvoices {

        @Test
        @DisplayName("Second request for the same stage returns the first invoice, whatever the case")
        void stageUniqueness() {
            printTestHeader("Stage invoice uniqueness");

            InvoiceCreation first = stage("Foundation", "10000");
            InvoiceCreation second = stage("Foundation", "20000");
            InvoiceCreation otherCase = stage("foundation", "30000");
            InvoiceCreation framing = stage("Framing", "5000");
            printOutput("First invoice", first.getInvoice());

            assertFalse(first.isExisting());
            assertTrue(second.isExisting());
            assertTrue(otherCase.isExisting());
            assertEquals(first.getInvoice().getId(), second.getInvoice().getId());
            assertEquals(first.getInvoice().getId(), otherCase.getInvoice().getId());
            assertEquals(new BigDecimal("10000.00"), second.getInvoice().getSubtotal());

            assertFalse(framing.isExisting());
            assertNotEquals(first.getInvoice().getId(), framing.getInvoice().getId());
            assertEquals(2, invoiceService.listInvoices(job.getId()).size());
            printSuccess("One invoice per stage name");
        }

        @Test
        @DisplayName("Approved variations of the stage roll into its invoice once")
        void variationRollUp() {
            printTestHeader("Stage invoice variation roll-up");
            Variation foundationExtra = approvedVariation(stageNamed("Foundation").getId(), "2000");
            approvedVariation(stageNamed("Framing").getId(), "3000");
            variation(stageNamed("Foundation").getId(), "999");

            Invoice invoice = stage("FOUNDATION", "10000").getInvoice();
            printOutput("Invoice", invoice);

            assertEquals(List.of(foundationExtra.getId()), invoice.getVariationIds());
            assertEquals(new BigDecimal("12000.00"), invoice.getSubtotal());
            assertEquals(new BigDecimal("2400.00"), invoice.getVat());
            assertEquals(new BigDecimal("14400.00"), invoice.getTotal());

            // the rolled-up variation is billed; asking for it on its own returns the stage invoice
            InvoiceCreation variationInvoice = forVariation(foundationExtra.getId());
            assertTrue(variationInvoice.isExisting());
            assertEquals(invoice.getId(), variationInvoice.getInvoice().getId());
            printSuccess("Variation billed exactly once");
        }

        @Test
        @DisplayName("A variation already invoiced on its own is not rolled into a stage")
        void variationBilledSeparately() {
            Variation extra = approvedVariation(stageNamed("Framing").getId(), "3000");
            forVariation(extra.getId());

            Invoice framing = stage("Framing", "5000").getInvoice();

            assertTrue(framing.getVariationIds().isEmpty());
            assertEquals(new BigDecimal("5000.00"), framing.getSubtotal());
        }

        @Test
        @DisplayName("Stage name is required")
        void stageNameRequired() {
            assertThrows(IllegalArgumentException.class, () -> stage(" ", "100"));
        }
    }

    @Nested
    @DisplayName("Final invoices")
    class FinalInvoices {

        @Test
        @DisplayName("Second final request returns the first invoice")
        void finalUniqueness() {
            printTestHeader("Final invoice uniqueness");

            InvoiceCreation first = fin("50000");
            InvoiceCreation second = fin("100000");

            assertFalse(first.isExisting());
            assertTrue(second.isExisting());
            assertEquals(first.getInvoice().getId(), second.getInvoice().getId());
            assertEquals(new BigDecimal("50000.00"), second.getInvoice().getSubtotal());
            printSuccess("One final invoice per job");
        }

        @Test
        @DisplayName("Issued certificates with a document are attached to the final invoice")
        void certificatesAttached() {
            Certificate eicr = certificateService.createCertificate(job.getId(), "EICR", "certs/eicr.pdf");
            certificateService.issueCertificate(eicr.getId(), "test-admin");
            certificateService.createCertificate(job.getId(), "Gas Safety", "certs/gas.pdf");

            Invoice invoice = fin("1000").getInvoice();
            List<InvoiceAttachment> attachments = invoiceService.listAttachments(invoice.getId());

            assertEquals(1, attachments.size());
            assertEquals("EICR Certificate", attachments.get(0).getName());
            assertEquals("certs/eicr.pdf", attachments.get(0).getFileKey());
            assertEquals("application/pdf", attachments.get(0).getMimeType());
        }

        @Test
        @DisplayName("Completion stage invoices also carry certificates")
        void completionStageAttachments() {
            Certificate eicr = certificateService.createCertificate(job.getId(), "EICR", "certs/eicr.pdf");
            certificateService.issueCertificate(eicr.getId(), "test-admin");

            Invoice completion = stage("Completion", "500").getInvoice();
            Invoice foundation = stage("Foundation", "500").getInvoice();

            assertEquals(1, invoiceService.listAttachments(completion.getId()).size());
            assertTrue(invoiceService.listAttachments(foundation.getId()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Variation invoices")
    class VariationInvoices {

        @Test
        @DisplayName("Variation invoice bills the variation's own amounts")
        void variationAmounts() {
            Variation extra = approvedVariation(null, "1234.56");

            Invoice invoice = forVariation(extra.getId()).getInvoice();

            assertEquals(extra.getId(), invoice.getVariationId());
            assertEquals(extra.getSubtotal(), invoice.getSubtotal());
            assertEquals(extra.getVat(), invoice.getVat());
            assertEquals(extra.getTotal(), invoice.getTotal());
            assertTrue(forVariation(extra.getId()).isExisting());
        }

        @Test
        @DisplayName("Unapproved variation cannot be invoiced")
        void unapprovedVariation() {
            Variation pending = variation(null, "100");

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> forVariation(pending.getId()));
            printExpectedException("IllegalStateException", e.getMessage());
            assertTrue(invoiceService.listInvoices(job.getId()).isEmpty());
        }

        @Test
        @DisplayName("Variation of another job is not found")
        void foreignVariation() {
            Job other = createJob("10");
            Variation foreign = variationService.createVariation(NewVariation.builder()
                    .jobId(other.getId())
                    .title("Elsewhere")
                    .item(new VariationItemInput("Thing", BigDecimal.ONE, BigDecimal.TEN))
                    .build(), "test-admin");
            settlementService.decideVariationByToken(foreign.getToken(), VariationDecision.APPROVE);

            assertThrows(NotFoundException.class, () -> forVariation(foreign.getId()));
        }
    }

    @Nested
    @DisplayName("Numbering and side effects")
    class Numbering {

        @Test
        @DisplayName("Numbers come from the job's legal entity and increase")
        void sequentialNumbers() {
            Invoice deposit = invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                    .jobId(job.getId()).type(InvoiceType.DEPOSIT).subtotal(new BigDecimal("100")).build(),
                    "test-admin").getInvoice();
            Invoice secondDeposit = invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                    .jobId(job.getId()).type(InvoiceType.DEPOSIT).subtotal(new BigDecimal("100")).build(),
                    "test-admin").getInvoice();

            assertEquals("SPK-00001", deposit.getInvoiceNumber());
            assertEquals("SPK-00002", secondDeposit.getInvoiceNumber());
            assertNotEquals(deposit.getId(), secondDeposit.getId());
            assertEquals(InvoiceStatus.DRAFT, deposit.getStatus());
            assertEquals("Jane Client", deposit.getClientName());
        }

        @Test
        @DisplayName("Job without a legal entity gets an unnumbered invoice")
        void noLegalEntity() {
            Job unregistered = createJob("100");

            Invoice invoice = invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                    .jobId(unregistered.getId()).type(InvoiceType.DEPOSIT).subtotal(BigDecimal.TEN).build(),
                    "test-admin").getInvoice();

            assertNull(invoice.getInvoiceNumber());
        }

        @Test
        @DisplayName("VAT rate falls back to the default and an explicit rate wins")
        void vatRate() {
            Invoice defaulted = stage("Foundation", "123.45").getInvoice();
            Invoice zeroRated = invoiceService.createInvoiceForJob(CreateInvoiceCommand.builder()
                    .jobId(job.getId()).type(InvoiceType.DEPOSIT).subtotal(new BigDecimal("123.45"))
                    .vatRate(BigDecimal.ZERO).build(), "test-admin").getInvoice();

            assertEquals(new BigDecimal("24.69"), defaulted.getVat());
            assertEquals(new BigDecimal("148.14"), defaulted.getTotal());
            assertEquals(0, zeroRated.getVat().signum());
            assertEquals(zeroRated.getSubtotal(), zeroRated.getTotal());
        }

        @Test
        @DisplayName("Creation is audited with the billed variations")
        void audited() {
            Variation extra = approvedVariation(stageNamed("Framing").getId(), "300");
            Invoice invoice = stage("Framing", "1000").getInvoice();

            List<AuditEvent> events = auditService.listForEntity("invoice", invoice.getId());
            assertEquals(1, events.size());
            assertEquals("invoice.created", events.get(0).getAction());
            assertTrue(events.get(0).getMeta().contains(extra.getId().toString()));
        }

        @Test
        @DisplayName("Unknown job is not found")
        void unknownJob() {
            assertThrows(NotFoundException.class, () -> invoiceService.createInvoiceForJob(
                    CreateInvoiceCommand.builder().jobId(UUID.randomUUID()).type(InvoiceType.FINAL).build(),
                    "test-admin"));
        }
    }
}
