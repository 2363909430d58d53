package com.flagship.job_ledger.variation;

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
@Table(name = "variation_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VariationItemEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "variation_id", nullable = false, updatable = false)
    private UUID variationId;

    @Column(nullable = false)
    private String description;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal total;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    static VariationItemEntity fromDomain(VariationItem item) {
        return new VariationItemEntity(item.getId(), item.getVariationId(), item.getDescription(),
                item.getQuantity(), item.getUnitPrice(), item.getTotal(), item.getSortOrder());
    }

    public VariationItem toDomain() {
        return new VariationItem(id, variationId, description, quantity, unitPrice, total, sortOrder);
    }
}
