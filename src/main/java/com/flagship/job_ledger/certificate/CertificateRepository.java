package com.flagship.job_ledger.certificate;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CertificateRepository extends JpaRepository<CertificateEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CertificateEntity c WHERE c.id = :id")
    Optional<CertificateEntity> findByIdForUpdate(@Param("id") UUID id);

    List<CertificateEntity> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    List<CertificateEntity> findByJobIdAndStatusOrderByCreatedAtAsc(UUID jobId, CertificateStatus status);
}
