package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.common.ActorHeaders;
import com.flagship.job_ledger.supplierbill.dto.CreateSupplierBillRequest;
import com.flagship.job_ledger.supplierbill.dto.ReplaceSupplierBillLinesRequest;
import com.flagship.job_ledger.supplierbill.dto.SupplierBillLineRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class SupplierBillController {

    private final SupplierBillService billService;
    private final SupplierBillPostingService postingService;

    @PostMapping("/jobs/{jobId}/supplier-bills")
    public ResponseEntity<SupplierBill> createSupplierBill(@PathVariable("jobId") UUID jobId,
                                                           @Valid @RequestBody CreateSupplierBillRequest request) {
        List<SupplierBillLineInput> lines = request.getLines().stream().map(SupplierBillLineRequest::toInput).toList();
        return ResponseEntity.status(HttpStatus.CREATED).body(billService.createSupplierBill(
                jobId, request.getSupplier(), request.getReference(), request.getBillDate(), lines));
    }

    @GetMapping("/jobs/{jobId}/supplier-bills")
    public ResponseEntity<List<SupplierBill>> listSupplierBills(@PathVariable("jobId") UUID jobId) {
        return ResponseEntity.ok(billService.listSupplierBills(jobId));
    }

    @GetMapping("/supplier-bills/{id}")
    public ResponseEntity<SupplierBill> getSupplierBill(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(billService.getSupplierBill(id));
    }

    @PutMapping("/supplier-bills/{id}/lines")
    public ResponseEntity<SupplierBill> replaceLines(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody ReplaceSupplierBillLinesRequest request) {
        List<SupplierBillLineInput> lines = request.getLines().stream().map(SupplierBillLineRequest::toInput).toList();
        return ResponseEntity.ok(billService.replaceSupplierBillLines(id, lines));
    }

    @PostMapping("/supplier-bills/{id}/post")
    public ResponseEntity<SupplierBill> postSupplierBill(
            @PathVariable("id") UUID id,
            @RequestHeader(value = ActorHeaders.ACTOR, defaultValue = ActorHeaders.DEFAULT_ACTOR) String actor) {
        return ResponseEntity.ok(postingService.postSupplierBill(id, actor));
    }
}
