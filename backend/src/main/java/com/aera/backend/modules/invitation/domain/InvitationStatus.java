package com.aera.backend.modules.invitation.domain;

public enum InvitationStatus {
    PENDING,
    ACCEPTED,
    REVOKED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
