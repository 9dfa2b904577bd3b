package com.aera.backend.modules.household.domain;

public enum HouseholdRole {
    OWNER,
    MEMBER;

    public HouseholdRole promote() {
        if (this != MEMBER) {
            throw new IllegalStateException("Only a MEMBER can be promoted to OWNER");
        }
        return OWNER;
    }

    public HouseholdRole demote() {
        if (this != OWNER) {
            throw new IllegalStateException("Only an OWNER can be demoted to MEMBER");
        }
        return MEMBER;
    }
}
