package com.aera.backend.modules.household.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.aera.backend.modules.household.domain.HouseholdJoinRequest;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JoinRequestResponse(
        UUID id,
        UUID householdId,
        String householdName,
        UUID requesterUserId,
        String status,
        OffsetDateTime createdAt,
        UUID resolvedByUserId,
        OffsetDateTime resolvedAt
) {

    public static JoinRequestResponse from(HouseholdJoinRequest request) {
        return new JoinRequestResponse(
                request.getId(),
                request.getHousehold().getId(),
                request.getHousehold().getName(),
                request.getRequesterUserId(),
                request.getStatus().name(),
                request.getCreatedAt(),
                request.getResolvedByUserId(),
                request.getResolvedAt()
        );
    }
}
