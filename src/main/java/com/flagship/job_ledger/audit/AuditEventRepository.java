package com.flagship.job_ledger.audit;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEventEntity, UUID> {

    List<AuditEventEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(String entityType, UUID entityId);

    List<AuditEventEntity> findByEntityTypeAndEntityIdAndAction(String entityType, UUID entityId, String action);
}
