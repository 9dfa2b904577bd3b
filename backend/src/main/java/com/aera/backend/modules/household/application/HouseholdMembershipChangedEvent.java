package com.aera.backend.modules.household.application;

import java.util.UUID;

/**
 * Published inside a membership transaction; consumed after commit to refresh readiness.
 */
public record HouseholdMembershipChangedEvent(UUID householdId, String reason) {
}
