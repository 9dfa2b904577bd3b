package com.aera.backend.modules.household.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record HouseholdResponse(
        UUID id,
        String name,
        String code,
        OffsetDateTime createdAt,
        List<HouseholdMemberResponse> members
) {
}
