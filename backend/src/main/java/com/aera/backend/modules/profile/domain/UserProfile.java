package com.aera.backend.modules.profile.domain;

import java.util.UUID;

import com.aera.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Per-identity household preferences. The id is the subject of the access token;
 * {@code organizationId} is provisioned by the directory service.
 */
@Entity
@Table(name = "user_profile")
public class UserProfile extends AbstractTimestampedEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "organization_id", columnDefinition = "uuid")
    private UUID organizationId;

    @Column(name = "active_household_id", columnDefinition = "uuid")
    private UUID activeHouseholdId;

    protected UserProfile() {
    }

    public UserProfile(UUID id) {
        this.id = id;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOrganizationId() {
        return organizationId;
    }

    public void setOrganizationId(UUID organizationId) {
        this.organizationId = organizationId;
    }

    public UUID getActiveHouseholdId() {
        return activeHouseholdId;
    }

    public void setActiveHouseholdId(UUID activeHouseholdId) {
        this.activeHouseholdId = activeHouseholdId;
    }
}
