package com.aera.backend.modules.household.presentation.dto;

import java.util.UUID;

public record LeaveHouseholdResponse(
        boolean success,
        UUID householdId,
        UUID userId,
        String role,
        boolean householdDeleted
) {
}
