package com.flagship.job_ledger.job;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JobRepository extends JpaRepository<JobEntity, UUID> {

    /**
     * Point read with a row lock (SELECT ... FOR UPDATE). Blocks until
     * concurrent writers of the same job commit, then sees their result.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JobEntity j WHERE j.id = :id")
    Optional<JobEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT j.clientEmail FROM JobEntity j WHERE j.id = :id")
    Optional<String> findClientEmail(@Param("id") UUID id);

    /**
     * Adds a delta to the budget in one statement ({@code x = x + delta}),
     * so concurrent approvals of different variations never lose an increment.
     *
     * @return number of rows updated, 0 when the job does not exist
     */
    @Modifying(flushAutomatically = true)
    @Query("""
        UPDATE JobEntity j
        SET j.budgetSubtotal = j.budgetSubtotal + :subtotal,
            j.budgetVat = j.budgetVat + :vat,
            j.budgetTotal = j.budgetTotal + :total,
            j.updatedAt = :now
        WHERE j.id = :id
        """)
    int incrementBudget(@Param("id") UUID id,
                        @Param("subtotal") BigDecimal subtotal,
                        @Param("vat") BigDecimal vat,
                        @Param("total") BigDecimal total,
                        @Param("now") Instant now);
}
