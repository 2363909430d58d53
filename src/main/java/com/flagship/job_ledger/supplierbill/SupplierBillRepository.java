package com.flagship.job_ledger.supplierbill;

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
public interface SupplierBillRepository extends JpaRepository<SupplierBillEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM SupplierBillEntity b WHERE b.id = :id")
    Optional<SupplierBillEntity> findByIdForUpdate(@Param("id") UUID id);

    List<SupplierBillEntity> findByJobIdOrderByCreatedAtAsc(UUID jobId);
}
