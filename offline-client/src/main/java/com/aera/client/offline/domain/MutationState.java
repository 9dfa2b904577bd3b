package com.aera.client.offline.domain;

/**
 * PENDING -> IN_FLIGHT -> DONE | PENDING (retry) | FAILED.
 */
public enum MutationState {
    PENDING,
    IN_FLIGHT,
    DONE,
    FAILED
}
