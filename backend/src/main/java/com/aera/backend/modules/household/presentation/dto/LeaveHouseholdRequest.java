package com.aera.backend.modules.household.presentation.dto;

import java.util.UUID;

/**
 * @param householdId optional; without it the active household is left
 */
public record LeaveHouseholdRequest(UUID householdId) {
}
