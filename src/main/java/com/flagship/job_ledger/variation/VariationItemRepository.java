package com.flagship.job_ledger.variation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface VariationItemRepository extends JpaRepository<VariationItemEntity, UUID> {

    List<VariationItemEntity> findByVariationIdOrderBySortOrderAsc(UUID variationId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM VariationItemEntity i WHERE i.variationId = :variationId")
    int deleteAllForVariation(@Param("variationId") UUID variationId);
}
