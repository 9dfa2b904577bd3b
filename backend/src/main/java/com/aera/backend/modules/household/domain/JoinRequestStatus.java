package com.aera.backend.modules.household.domain;

public enum JoinRequestStatus {
    PENDING,
    APPROVED,
    REJECTED
}
