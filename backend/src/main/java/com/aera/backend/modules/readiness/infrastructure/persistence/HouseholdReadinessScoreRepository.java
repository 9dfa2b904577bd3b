package com.aera.backend.modules.readiness.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.aera.backend.modules.readiness.domain.HouseholdReadinessScore;

public interface HouseholdReadinessScoreRepository extends JpaRepository<HouseholdReadinessScore, UUID> {
}
