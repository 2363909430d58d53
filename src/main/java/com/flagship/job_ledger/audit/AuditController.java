package com.flagship.job_ledger.audit;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
public class AuditController {

    private final AuditService auditService;

    @GetMapping("/{entityType}/{entityId}")
    public ResponseEntity<List<AuditEvent>> listForEntity(@PathVariable("entityType") String entityType,
                                                          @PathVariable("entityId") UUID entityId) {
        return ResponseEntity.ok(auditService.listForEntity(entityType, entityId));
    }
}
