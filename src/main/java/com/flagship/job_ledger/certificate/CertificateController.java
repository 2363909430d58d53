package com.flagship.job_ledger.certificate;

import com.flagship.job_ledger.common.ActorHeaders;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.Value;
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
public class CertificateController {

    private final CertificateService certificateService;

    @PostMapping("/jobs/{jobId}/certificates")
    public ResponseEntity<Certificate> createCertificate(@PathVariable("jobId") UUID jobId,
                                                         @Valid @RequestBody CreateCertificateRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(certificateService.createCertificate(jobId, request.getType(), request.getPdfKey()));
    }

    @GetMapping("/jobs/{jobId}/certificates")
    public ResponseEntity<List<Certificate>> listCertificates(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(certificateService.listCertificates(jobId));
    }

    @PostMapping("/certificates/{id}/issue")
    public ResponseEntity<Certificate> issueCertificate(
            @PathVariable("id") UUID id,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(certificateService.issueCertificate(id, actor));
    }

    @Value
    public static class CreateCertificateRequest {
        @NotBlank(message = "Type is required")
        String type;
        String pdfKey;
    }
}
