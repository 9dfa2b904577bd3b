package com.aera.backend.modules.household.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.aera.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One identity's seat in one household. At most one row per (household, user) and at most
 * one OWNER row per household; both are enforced by database indexes.
 */
@Entity
@Table(name = "household_membership")
public class HouseholdMembership extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "household_id", nullable = false, updatable = false)
    private Household household;

    @Column(name = "user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private HouseholdRole role;

    @Column(name = "joined_at", nullable = false, updatable = false)
    private OffsetDateTime joinedAt;

    protected HouseholdMembership() {
    }

    public HouseholdMembership(Household household, UUID userId, HouseholdRole role, OffsetDateTime joinedAt) {
        this.household = household;
        this.userId = userId;
        this.role = role;
        this.joinedAt = joinedAt;
    }

    public UUID getId() {
        return id;
    }

    public Household getHousehold() {
        return household;
    }

    public UUID getUserId() {
        return userId;
    }

    public HouseholdRole getRole() {
        return role;
    }

    public boolean isOwner() {
        return role == HouseholdRole.OWNER;
    }

    public void promote() {
        this.role = role.promote();
    }

    public void demote() {
        this.role = role.demote();
    }

    public OffsetDateTime getJoinedAt() {
        return joinedAt;
    }
}
