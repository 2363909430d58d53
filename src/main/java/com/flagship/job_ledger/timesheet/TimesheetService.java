package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Timesheet authoring: open a week, log entries, submit for approval.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimesheetService {

    private final TimesheetRepository timesheetRepository;
    private final TimeEntryRepository timeEntryRepository;
    private final EngineerRepository engineerRepository;
    private final JobRepository jobRepository;

    @Transactional
    public Timesheet createTimesheet(UUID engineerId, LocalDate weekStart) {
        if (!engineerRepository.existsById(engineerId)) {
            throw NotFoundException.of("Engineer", engineerId);
        }
        Timesheet timesheet = Timesheet.create(engineerId, weekStart);
        log.info("Creating timesheet {} for engineer {} week {}", timesheet.getId(), engineerId, weekStart);
        return timesheetRepository.save(TimesheetEntity.fromDomain(timesheet)).toDomain();
    }

    /**
     * @throws IllegalStateException once the timesheet has been approved or rejected
     */
    @Transactional
    public TimeEntry logTimeEntry(UUID timesheetId, UUID jobId, Instant startedAt, Instant endedAt,
                                  int breakMinutes) {
        Timesheet timesheet = timesheetRepository.findByIdForUpdate(timesheetId)
                .map(TimesheetEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Timesheet", timesheetId));
        if (timesheet.isApproved() || timesheet.isRejected()) {
            throw new IllegalStateException(
                String.format("Cannot log time on timesheet %s in %s status", timesheetId, timesheet.getStatus()));
        }
        if (!jobRepository.existsById(jobId)) {
            throw NotFoundException.of("Job", jobId);
        }
        TimeEntry entry = TimeEntry.create(timesheetId, jobId, timesheet.getEngineerId(), startedAt, endedAt,
                breakMinutes);
        return timeEntryRepository.save(TimeEntryEntity.fromDomain(entry)).toDomain();
    }

    @Transactional
    public Timesheet submitTimesheet(UUID timesheetId) {
        TimesheetEntity entity = timesheetRepository.findByIdForUpdate(timesheetId)
                .orElseThrow(() -> NotFoundException.of("Timesheet", timesheetId));
        Timesheet submitted = entity.toDomain().submit();
        entity.updateFromDomain(submitted);
        timesheetRepository.save(entity);

        for (TimeEntryEntity entry : timeEntryRepository.findByTimesheetIdOrderByStartedAtAsc(timesheetId)) {
            entry.updateStatusFromDomain(entry.toDomain().submit());
            timeEntryRepository.save(entry);
        }
        log.info("Timesheet submitted: timesheetId={}", timesheetId);
        return submitted;
    }

    @Transactional(readOnly = true)
    public Timesheet getTimesheet(UUID timesheetId) {
        return timesheetRepository.findById(timesheetId)
                .map(TimesheetEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Timesheet", timesheetId));
    }

    @Transactional(readOnly = true)
    public List<TimeEntry> listEntries(UUID timesheetId) {
        return timeEntryRepository.findByTimesheetIdOrderByStartedAtAsc(timesheetId).stream()
                .map(TimeEntryEntity::toDomain)
                .toList();
    }
}
