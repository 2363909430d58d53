package com.flagship.job_ledger.job;

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
@Table(name = "job_budget_lines")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobBudgetLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

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

    static JobBudgetLineEntity fromDomain(JobBudgetLine line) {
        return new JobBudgetLineEntity(line.getId(), line.getJobId(), line.getDescription(),
                line.getQuantity(), line.getUnitPrice(), line.getTotal(), line.getSortOrder());
    }

    public JobBudgetLine toDomain() {
        return new JobBudgetLine(id, jobId, description, quantity, unitPrice, total, sortOrder);
    }
}
