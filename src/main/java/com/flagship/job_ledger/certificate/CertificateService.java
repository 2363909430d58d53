package com.flagship.job_ledger.certificate;

import com.flagship.job_ledger.audit.AuditService;
import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobEntity;
import com.flagship.job_ledger.job.JobRepository;
import com.flagship.job_ledger.numbering.LegalEntityNumberingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class CertificateService {

    private final CertificateRepository certificateRepository;
    private final JobRepository jobRepository;
    private final LegalEntityNumberingService numberingService;
    private final AuditService auditService;

    @Transactional
    public Certificate createCertificate(UUID jobId, String type, String pdfKey) {
        if (!jobRepository.existsById(jobId)) {
            throw NotFoundException.of("Job", jobId);
        }
        Certificate certificate = Certificate.draft(jobId, type, pdfKey);
        log.info("Creating {} certificate {} for job {}", certificate.getType(), certificate.getId(), jobId);
        return certificateRepository.save(CertificateEntity.fromDomain(certificate)).toDomain();
    }

    /**
     * DRAFT -> ISSUED, numbered from the job's legal entity. Issuing an issued
     * certificate returns it unchanged.
     */
    @Transactional
    public Certificate issueCertificate(UUID certificateId, String actor) {
        CertificateEntity entity = certificateRepository.findByIdForUpdate(certificateId)
                .orElseThrow(() -> NotFoundException.of("Certificate", certificateId));
        Certificate certificate = entity.toDomain();
        if (certificate.isIssued()) {
            return certificate;
        }

        UUID legalEntityId = certificate.getJobId() == null
                ? null
                : jobRepository.findById(certificate.getJobId()).map(JobEntity::getLegalEntityId).orElse(null);
        String number = numberingService.allocateCertificateNumber(legalEntityId);

        Certificate issued = certificate.issue(number);
        entity.updateFromDomain(issued);
        certificateRepository.save(entity);

        Map<String, Object> meta = new HashMap<>();
        meta.put("certificateNumber", number);
        meta.put("jobId", issued.getJobId());
        auditService.record("certificate", certificateId, "certificate.issued", AuditService.ROLE_ADMIN, actor, meta);
        log.info("Certificate issued: certificateId={}, number={}", certificateId, number);
        return issued;
    }

    @Transactional
    public Certificate attachDocument(UUID certificateId, String pdfKey) {
        CertificateEntity entity = certificateRepository.findByIdForUpdate(certificateId)
                .orElseThrow(() -> NotFoundException.of("Certificate", certificateId));
        Certificate updated = entity.toDomain().withPdfKey(pdfKey);
        entity.updateFromDomain(updated);
        certificateRepository.save(entity);
        return updated;
    }

    @Transactional(readOnly = true)
    public List<Certificate> listCertificates(UUID jobId) {
        return certificateRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(CertificateEntity::toDomain)
                .toList();
    }

    /**
     * Issued certificates of a job that have a document to attach.
     */
    @Transactional(readOnly = true)
    public List<Certificate> attachableCertificates(UUID jobId) {
        return certificateRepository.findByJobIdAndStatusOrderByCreatedAtAsc(jobId, CertificateStatus.ISSUED).stream()
                .map(CertificateEntity::toDomain)
                .filter(Certificate::isAttachable)
                .toList();
    }
}
