package com.flagship.job_ledger.timesheet;

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
@Table(name = "rate_cards")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RateCardEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "cost_rate_per_hour", nullable = false, precision = 19, scale = 4)
    private BigDecimal costRatePerHour;

    static RateCardEntity fromDomain(RateCard rateCard) {
        return new RateCardEntity(rateCard.getId(), rateCard.getName(), rateCard.getCostRatePerHour());
    }

    public RateCard toDomain() {
        return new RateCard(id, name, costRatePerHour);
    }
}
