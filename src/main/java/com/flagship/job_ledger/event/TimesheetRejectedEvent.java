package com.flagship.job_ledger.event;

import com.flagship.job_ledger.timesheet.Timesheet;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class TimesheetRejectedEvent implements LedgerEvent {
    UUID eventId;
    UUID timesheetId;
    UUID engineerId;
    String rejectedBy;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TimesheetRejected";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Timesheet";
    }

    @Override
    public UUID getAggregateId() {
        return timesheetId;
    }

    public static TimesheetRejectedEvent from(Timesheet timesheet) {
        return new TimesheetRejectedEvent(
            UUID.randomUUID(),
            timesheet.getId(),
            timesheet.getEngineerId(),
            timesheet.getApprovedBy(),
            timesheet.getNotes(),
            Instant.now()
        );
    }
}
