package com.aera.backend.modules.readiness.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

@Entity
@Table(name = "household_readiness_score")
public class HouseholdReadinessScore {

    @Id
    @Column(name = "household_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID householdId;

    @Column(name = "score")
    private Integer score;

    @Column(name = "tier", nullable = false, length = 32)
    private String tier;

    @Column(name = "member_count", nullable = false)
    private int memberCount;

    @Column(name = "last_assessed_at", nullable = false)
    private OffsetDateTime lastAssessedAt;

    protected HouseholdReadinessScore() {
    }

    public HouseholdReadinessScore(UUID householdId) {
        this.householdId = householdId;
    }

    public void apply(Integer score, String tier, int memberCount, OffsetDateTime assessedAt) {
        this.score = score;
        this.tier = tier;
        this.memberCount = memberCount;
        this.lastAssessedAt = assessedAt;
    }

    public UUID getHouseholdId() {
        return householdId;
    }

    public Integer getScore() {
        return score;
    }

    public String getTier() {
        return tier;
    }

    public int getMemberCount() {
        return memberCount;
    }

    public OffsetDateTime getLastAssessedAt() {
        return lastAssessedAt;
    }
}
