package com.flagship.job_ledger.costing.dto;

import com.flagship.job_ledger.costing.CostItem;
import com.flagship.job_ledger.costing.CostType;
import com.flagship.job_ledger.costing.LockStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class CostItemResponse {
    UUID id;
    UUID jobId;
    UUID stageId;
    CostType type;
    String source;
    LockStatus lockStatus;
    String supplier;
    String description;
    BigDecimal quantity;
    BigDecimal unitCost;
    BigDecimal markupPct;
    BigDecimal totalCost;
    Instant incurredAt;
    Instant createdAt;
    Instant updatedAt;

    public static CostItemResponse from(CostItem item) {
        return CostItemResponse.builder()
            .id(item.getId())
            .jobId(item.getJobId())
            .stageId(item.getStageId())
            .type(item.getType())
            .source(item.getSource().key())
            .lockStatus(item.getLockStatus())
            .supplier(item.getSupplier())
            .description(item.getDescription())
            .quantity(item.getQuantity())
            .unitCost(item.getUnitCost())
            .markupPct(item.getMarkupPct())
            .totalCost(item.getTotalCost())
            .incurredAt(item.getIncurredAt())
            .createdAt(item.getCreatedAt())
            .updatedAt(item.getUpdatedAt())
            .build();
    }
}
