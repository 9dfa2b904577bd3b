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
 * A user's request to join a household found by its code. Only the owner decides it, once.
 */
@Entity
@Table(name = "household_join_request")
public class HouseholdJoinRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "household_id", nullable = false, updatable = false)
    private Household household;

    @Column(name = "requester_user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID requesterUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private JoinRequestStatus status = JoinRequestStatus.PENDING;

    @Column(name = "resolved_by_user_id", columnDefinition = "uuid")
    private UUID resolvedByUserId;

    @Column(name = "resolved_at")
    private OffsetDateTime resolvedAt;

    protected HouseholdJoinRequest() {
    }

    public HouseholdJoinRequest(Household household, UUID requesterUserId) {
        this.household = household;
        this.requesterUserId = requesterUserId;
    }

    public boolean isPending() {
        return status == JoinRequestStatus.PENDING;
    }

    public void approve(UUID ownerId, OffsetDateTime now) {
        resolve(JoinRequestStatus.APPROVED, ownerId, now);
    }

    public void reject(UUID ownerId, OffsetDateTime now) {
        resolve(JoinRequestStatus.REJECTED, ownerId, now);
    }

    private void resolve(JoinRequestStatus outcome, UUID ownerId, OffsetDateTime now) {
        if (status != JoinRequestStatus.PENDING) {
            throw new IllegalStateException("Join request " + id + " is already " + status);
        }
        this.status = outcome;
        this.resolvedByUserId = ownerId;
        this.resolvedAt = now;
    }

    @Override
    public UUID getId() {
        return id;
    }

    public Household getHousehold() {
        return household;
    }

    public UUID getRequesterUserId() {
        return requesterUserId;
    }

    public JoinRequestStatus getStatus() {
        return status;
    }

    public UUID getResolvedByUserId() {
        return resolvedByUserId;
    }

    public OffsetDateTime getResolvedAt() {
        return resolvedAt;
    }
}
