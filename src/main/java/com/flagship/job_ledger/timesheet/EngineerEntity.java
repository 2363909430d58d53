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
@Table(name = "engineers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EngineerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    private String name;

    @Column(nullable = false)
    private String email;

    @Column(name = "cost_rate_per_hour", precision = 19, scale = 4)
    private BigDecimal costRatePerHour;

    @Column(name = "rate_card_id")
    private UUID rateCardId;

    static EngineerEntity fromDomain(Engineer engineer) {
        return new EngineerEntity(engineer.getId(), engineer.getName(), engineer.getEmail(),
                engineer.getCostRatePerHour(), engineer.getRateCardId());
    }

    public Engineer toDomain() {
        return new Engineer(id, name, email, costRatePerHour, rateCardId);
    }
}
