package com.flagship.job_ledger.event;

import com.flagship.job_ledger.timesheet.Timesheet;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a timesheet is approved and its labour costs are locked in.
 */
@Value
public class TimesheetApprovedEvent implements LedgerEvent {
    UUID eventId;
    UUID timesheetId;
    UUID engineerId;
    String approvedBy;
    List<UUID> costItemIds;
    BigDecimal totalHours;
    BigDecimal totalCost;
    Instant occurredAt;

    public static final String EVENT_TYPE = "TimesheetApproved";

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

    public static TimesheetApprovedEvent from(Timesheet timesheet, List<UUID> costItemIds,
                                              BigDecimal totalHours, BigDecimal totalCost) {
        return new TimesheetApprovedEvent(
            UUID.randomUUID(),
            timesheet.getId(),
            timesheet.getEngineerId(),
            timesheet.getApprovedBy(),
            List.copyOf(costItemIds),
            totalHours,
            totalCost,
            Instant.now()
        );
    }
}
