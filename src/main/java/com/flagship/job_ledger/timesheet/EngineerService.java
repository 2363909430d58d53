package com.flagship.job_ledger.timesheet;

import com.flagship.job_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class EngineerService {

    private final EngineerRepository engineerRepository;
    private final RateCardRepository rateCardRepository;

    @Transactional
    public RateCard createRateCard(String name, BigDecimal costRatePerHour) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Rate card name is required");
        }
        if (costRatePerHour == null || costRatePerHour.signum() < 0) {
            throw new IllegalArgumentException("Rate card cost rate must be zero or more");
        }
        RateCard rateCard = new RateCard(UUID.randomUUID(), name.trim(), costRatePerHour);
        return rateCardRepository.save(RateCardEntity.fromDomain(rateCard)).toDomain();
    }

    /**
     * @param costRatePerHour optional; used when the engineer has no rate card
     * @param rateCardId optional
     */
    @Transactional
    public Engineer createEngineer(String name, String email, BigDecimal costRatePerHour, UUID rateCardId) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Engineer email is required");
        }
        if (rateCardId != null && !rateCardRepository.existsById(rateCardId)) {
            throw NotFoundException.of("RateCard", rateCardId);
        }
        Engineer engineer = new Engineer(UUID.randomUUID(), name, email.trim(), costRatePerHour, rateCardId);
        log.debug("Creating engineer {} with rate card {}", engineer.getId(), rateCardId);
        return engineerRepository.save(EngineerEntity.fromDomain(engineer)).toDomain();
    }

    @Transactional(readOnly = true)
    public Engineer getEngineer(UUID engineerId) {
        return engineerRepository.findById(engineerId)
                .map(EngineerEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Engineer", engineerId));
    }
}
