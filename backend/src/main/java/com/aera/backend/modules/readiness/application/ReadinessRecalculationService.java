package com.aera.backend.modules.readiness.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.readiness.domain.HouseholdReadinessScore;
import com.aera.backend.modules.readiness.infrastructure.persistence.HouseholdReadinessScoreRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ReadinessRecalculationService {

    private static final Logger log = LoggerFactory.getLogger(ReadinessRecalculationService.class);

    private final HouseholdRepository householdRepository;
    private final HouseholdMembershipRepository membershipRepository;
    private final HouseholdReadinessScoreRepository scoreRepository;
    private final ReadinessCalculator calculator;
    private final Clock clock;

    public ReadinessRecalculationService(
            HouseholdRepository householdRepository,
            HouseholdMembershipRepository membershipRepository,
            HouseholdReadinessScoreRepository scoreRepository,
            ReadinessCalculator calculator,
            Clock clock
    ) {
        this.householdRepository = householdRepository;
        this.membershipRepository = membershipRepository;
        this.scoreRepository = scoreRepository;
        this.calculator = calculator;
        this.clock = clock;
    }

    /**
     * @return the stored score, or empty when the household no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<HouseholdReadinessScore> recalculate(UUID householdId) {
        if (!householdRepository.existsById(householdId)) {
            log.debug("Skipping readiness for deleted household {}", householdId);
            return Optional.empty();
        }
        int memberCount = Math.toIntExact(membershipRepository.countByHouseholdId(householdId));
        ReadinessResult result = calculator.calculate(new ReadinessInput(householdId, memberCount));

        HouseholdReadinessScore score = scoreRepository.findById(householdId)
                .orElseGet(() -> new HouseholdReadinessScore(householdId));
        score.apply(result.score(), result.tier(), memberCount, OffsetDateTime.now(clock));
        return Optional.of(scoreRepository.save(score));
    }
}
