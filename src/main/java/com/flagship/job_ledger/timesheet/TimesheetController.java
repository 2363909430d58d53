package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.timesheet.dto.CreateTimesheetRequest;
import com.flagship.job_ledger.timesheet.dto.RejectTimesheetRequest;
import com.flagship.job_ledger.timesheet.dto.TimeEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/timesheets")
@RequiredArgsConstructor
public class TimesheetController {

    private final TimesheetService timesheetService;
    private final TimesheetApprovalService approvalService;

    @PostMapping
    public ResponseEntity<Timesheet> createTimesheet(@Valid @RequestBody CreateTimesheetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(timesheetService.createTimesheet(request.getEngineerId(), request.getWeekStart()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Timesheet> getTimesheet(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(timesheetService.getTimesheet(id));
    }

    @GetMapping("/{id}/entries")
    public ResponseEntity<List<TimeEntry>> listEntries(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(timesheetService.listEntries(id));
    }

    @PostMapping("/{id}/entries")
    public ResponseEntity<TimeEntry> logTimeEntry(@PathVariable("id") UUID id,
                                                  @Valid @RequestBody TimeEntryRequest request) {
        int breakMinutes = request.getBreakMinutes() != null ? request.getBreakMinutes() : 0;
        return ResponseEntity.status(HttpStatus.CREATED).body(timesheetService.logTimeEntry(
                id, request.getJobId(), request.getStartedAt(), request.getEndedAt(), breakMinutes));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<Timesheet> submitTimesheet(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(timesheetService.submitTimesheet(id));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Timesheet> approveTimesheet(
            @PathVariable("id") UUID id,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(approvalService.approveTimesheet(id, actor));
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<Timesheet> rejectTimesheet(
            @PathVariable("id") UUID id,
            @Valid @RequestBody RejectTimesheetRequest request,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(approvalService.rejectTimesheet(id, actor, request.getReason()));
    }
}
