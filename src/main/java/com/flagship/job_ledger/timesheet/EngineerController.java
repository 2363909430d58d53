package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.timesheet.dto.CreateEngineerRequest;
import com.flagship.job_ledger.timesheet.dto.CreateRateCardRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineerController {

    private final EngineerService engineerService;

    @PostMapping("/rate-cards")
    public ResponseEntity<RateCard> createRateCard(@Valid @RequestBody CreateRateCardRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(engineerService.createRateCard(request.getName(), request.getCostRatePerHour()));
    }

    @PostMapping("/engineers")
    public ResponseEntity<Engineer> createEngineer(@Valid @RequestBody CreateEngineerRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(engineerService.createEngineer(
                request.getName(), request.getEmail(), request.getCostRatePerHour(), request.getRateCardId()));
    }

    @GetMapping("/engineers/{id}")
    public ResponseEntity<Engineer> getEngineer(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(engineerService.getEngineer(id));
    }
}
