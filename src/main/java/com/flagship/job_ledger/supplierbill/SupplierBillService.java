package com.flagship.job_ledger.supplierbill;

import com.flagship.job_ledger.exception.NotFoundException;
import com.flagship.job_ledger.job.JobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Supplier bill authoring. Posting lives in {@link SupplierBillPostingService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SupplierBillService {

    private final SupplierBillRepository billRepository;
    private final SupplierBillLineRepository lineRepository;
    private final JobRepository jobRepository;

    @Transactional
    public SupplierBill createSupplierBill(UUID jobId, String supplier, String reference, Instant billDate,
                                          List<SupplierBillLineInput> inputs) {
        if (!jobRepository.existsById(jobId)) {
            throw NotFoundException.of("Job", jobId);
        }
        UUID billId = UUID.randomUUID();
        List<SupplierBillLine> lines = toLines(billId, inputs);
        SupplierBill bill = SupplierBill.create(billId, jobId, supplier, reference, billDate, lines);

        SupplierBillEntity saved = billRepository.save(SupplierBillEntity.fromDomain(bill));
        lines.forEach(line -> lineRepository.save(SupplierBillLineEntity.fromDomain(line)));

        log.info("Supplier bill created: billId={}, jobId={}, lines={}, subtotal={}",
                billId, jobId, lines.size(), bill.getSubtotal());
        return saved.toDomain(lines);
    }

    /**
     * @throws IllegalStateException if the bill has been posted
     */
    @Transactional
    public SupplierBill replaceSupplierBillLines(UUID billId, List<SupplierBillLineInput> inputs) {
        SupplierBillEntity entity = billRepository.findByIdForUpdate(billId)
                .orElseThrow(() -> NotFoundException.of("SupplierBill", billId));

        List<SupplierBillLine> lines = toLines(billId, inputs);
        SupplierBill updated = entity.toDomain(List.of()).withLines(lines);

        lineRepository.deleteAllForBill(billId);
        lines.forEach(line -> lineRepository.save(SupplierBillLineEntity.fromDomain(line)));
        entity.updateFromDomain(updated);
        billRepository.save(entity);

        log.info("Supplier bill lines replaced: billId={}, lines={}, subtotal={}",
                billId, lines.size(), updated.getSubtotal());
        return updated;
    }

    @Transactional(readOnly = true)
    public SupplierBill getSupplierBill(UUID billId) {
        SupplierBillEntity entity = billRepository.findById(billId)
                .orElseThrow(() -> NotFoundException.of("SupplierBill", billId));
        return entity.toDomain(linesOf(billId));
    }

    @Transactional(readOnly = true)
    public List<SupplierBill> listSupplierBills(UUID jobId) {
        return billRepository.findByJobIdOrderByCreatedAtAsc(jobId).stream()
                .map(entity -> entity.toDomain(linesOf(entity.getId())))
                .toList();
    }

    private List<SupplierBillLine> linesOf(UUID billId) {
        return lineRepository.findByBillIdOrderBySortOrderAsc(billId).stream()
                .map(SupplierBillLineEntity::toDomain)
                .toList();
    }

    private static List<SupplierBillLine> toLines(UUID billId, List<SupplierBillLineInput> inputs) {
        List<SupplierBillLine> lines = new ArrayList<>();
        if (inputs == null) {
            return lines;
        }
        int order = 0;
        for (SupplierBillLineInput input : inputs) {
            lines.add(SupplierBillLine.create(billId, input, order++));
        }
        return lines;
    }
}
