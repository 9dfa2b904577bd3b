package com.aera.backend.modules.invitation.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.aera.backend.global.jpa.AbstractTimestampedEntity;
import com.aera.backend.modules.household.domain.Household;

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
 * Single-use join code. A PENDING invitation moves to exactly one terminal status.
 */
@Entity
@Table(name = "household_invitation")
public class HouseholdInvitation extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "household_id", nullable = false, updatable = false)
    private Household household;

    @Column(name = "inviter_user_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID inviterUserId;

    @Column(name = "code", nullable = false, updatable = false, length = 6)
    private String code;

    @Column(name = "invitee_ref", length = 32)
    private String inviteeRef;

    @Column(name = "invitee_name", length = 120)
    private String inviteeName;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private InvitationStatus status = InvitationStatus.PENDING;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "accepted_by_user_id", columnDefinition = "uuid")
    private UUID acceptedByUserId;

    @Column(name = "accepted_at")
    private OffsetDateTime acceptedAt;

    protected HouseholdInvitation() {
    }

    public HouseholdInvitation(
            Household household,
            UUID inviterUserId,
            String code,
            String inviteeRef,
            String inviteeName,
            OffsetDateTime expiresAt
    ) {
        this.household = household;
        this.inviterUserId = inviterUserId;
        this.code = code;
        this.inviteeRef = inviteeRef;
        this.inviteeName = inviteeName;
        this.expiresAt = expiresAt;
    }

    public boolean isPending() {
        return status == InvitationStatus.PENDING;
    }

    public boolean isExpiredAt(OffsetDateTime now) {
        return status == InvitationStatus.EXPIRED || (isPending() && !now.isBefore(expiresAt));
    }

    public boolean isBound() {
        return inviteeRef != null && !inviteeRef.isBlank();
    }

    public boolean acceptsInvitee(String presentedPhone) {
        return !isBound() || InviteePhone.matches(inviteeRef, presentedPhone);
    }

    public void accept(UUID userId, OffsetDateTime now) {
        requirePending();
        this.status = InvitationStatus.ACCEPTED;
        this.acceptedByUserId = userId;
        this.acceptedAt = now;
    }

    public void revoke() {
        requirePending();
        this.status = InvitationStatus.REVOKED;
    }

    public void expire() {
        requirePending();
        this.status = InvitationStatus.EXPIRED;
    }

    private void requirePending() {
        if (status != InvitationStatus.PENDING) {
            throw new IllegalStateException("Invitation " + id + " is already " + status);
        }
    }

    public UUID getId() {
        return id;
    }

    public Household getHousehold() {
        return household;
    }

    public UUID getInviterUserId() {
        return inviterUserId;
    }

    public String getCode() {
        return code;
    }

    public String getInviteeRef() {
        return inviteeRef;
    }

    public String getInviteeName() {
        return inviteeName;
    }

    public InvitationStatus getStatus() {
        return status;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public UUID getAcceptedByUserId() {
        return acceptedByUserId;
    }

    public OffsetDateTime getAcceptedAt() {
        return acceptedAt;
    }
}
