package com.flagship.job_ledger.variation;

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
public interface VariationRepository extends JpaRepository<VariationEntity, UUID> {

    Optional<VariationEntity> findByToken(String token);

    /**
     * Row-locked read by the client token. Concurrent decisions on one
     * variation queue here; each sees the previous decision once it commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VariationEntity v WHERE v.token = :token")
    Optional<VariationEntity> findForUpdateByToken(@Param("token") String token);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM VariationEntity v WHERE v.id = :id")
    Optional<VariationEntity> findByIdForUpdate(@Param("id") UUID id);

    List<VariationEntity> findByJobIdOrderByCreatedAtAsc(UUID jobId);

    List<VariationEntity> findByJobIdAndStatusOrderByCreatedAtAsc(UUID jobId, VariationStatus status);
}
