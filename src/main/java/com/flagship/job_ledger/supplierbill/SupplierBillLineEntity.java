package com.flagship.job_ledger.supplierbill;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "supplier_bill_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SupplierBillLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "bill_id", nullable = false, updatable = false)
    private UUID billId;

    @Column(nullable = false)
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_cost", nullable = false, precision = 19, scale = 4)
    private BigDecimal unitCost;

    @Column(name = "vat_rate", nullable = false, precision = 7, scale = 4)
    private BigDecimal vatRate;

    @Column(name = "total_ex_vat", nullable = false, precision = 19, scale = 2)
    private BigDecimal totalExVat;

    @Column(name = "cost_item_id")
    private UUID costItemId;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    static SupplierBillLineEntity fromDomain(SupplierBillLine line) {
        return new SupplierBillLineEntity(line.getId(), line.getBillId(), line.getDescription(), line.getQuantity(),
                line.getUnitCost(), line.getVatRate(), line.getTotalExVat(), line.getCostItemId(), line.getSortOrder());
    }

    public SupplierBillLine toDomain() {
        return new SupplierBillLine(id, billId, description, quantity, unitCost, vatRate, totalExVat, costItemId,
                sortOrder);
    }

    void linkCostItem(UUID itemId) {
        this.costItemId = itemId;
    }
}
