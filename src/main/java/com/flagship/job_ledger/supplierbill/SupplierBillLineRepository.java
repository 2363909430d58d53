package com.flagship.job_ledger.supplierbill;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SupplierBillLineRepository extends JpaRepository<SupplierBillLineEntity, UUID> {

    List<SupplierBillLineEntity> findByBillIdOrderBySortOrderAsc(UUID billId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM SupplierBillLineEntity l WHERE l.billId = :billId")
    int deleteAllForBill(@Param("billId") UUID billId);
}
