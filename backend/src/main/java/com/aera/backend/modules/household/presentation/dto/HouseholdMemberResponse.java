package com.aera.backend.modules.household.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record HouseholdMemberResponse(
        UUID userId,
        String role,
        OffsetDateTime joinedAt
) {
}
