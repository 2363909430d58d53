package com.flagship.job_ledger.timesheet;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TimeEntryRepository extends JpaRepository<TimeEntryEntity, UUID> {

    List<TimeEntryEntity> findByTimesheetIdOrderByStartedAtAsc(UUID timesheetId);
}
