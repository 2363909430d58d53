package com.flagship.job_ledger.timesheet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface RateCardRepository extends JpaRepository<RateCardEntity, UUID> {
}
