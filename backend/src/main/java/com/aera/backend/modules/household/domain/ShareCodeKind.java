package com.aera.backend.modules.household.domain;

public enum ShareCodeKind {
    HOUSEHOLD,
    INVITATION
}
