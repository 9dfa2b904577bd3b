package com.aera.backend.modules.household.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record MembershipResponse(
        UUID householdId,
        String householdName,
        String householdCode,
        UUID userId,
        String role,
        OffsetDateTime joinedAt,
        boolean active
) {
}
