package com.flagship.job_ledger.supplierbill;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Bill header. Lines live in {@link SupplierBillLineEntity}.
 */
@Entity
@Table(name = "supplier_bills")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SupplierBillEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false)
    private String supplier;

    private String reference;

    @Column(name = "bill_date")
    private Instant billDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SupplierBillStatus status;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal vat;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static SupplierBillEntity fromDomain(SupplierBill bill) {
        return new SupplierBillEntity(bill.getId(), bill.getJobId(), bill.getSupplier(), bill.getReference(),
                bill.getBillDate(), bill.getStatus(), bill.getPostedAt(), bill.getSubtotal(), bill.getVat(),
                bill.getTotal(), null, null);
    }

    public SupplierBill toDomain(List<SupplierBillLine> lines) {
        return new SupplierBill(id, jobId, supplier, reference, billDate, status, postedAt, subtotal, vat, total,
                createdAt, updatedAt, lines);
    }

    void updateFromDomain(SupplierBill bill) {
        this.status = bill.getStatus();
        this.postedAt = bill.getPostedAt();
        this.subtotal = bill.getSubtotal();
        this.vat = bill.getVat();
        this.total = bill.getTotal();
    }
}
