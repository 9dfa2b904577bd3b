package com.aera.backend.modules.invitation.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.aera.backend.modules.invitation.domain.HouseholdInvitation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvitationResponse(
        UUID id,
        UUID householdId,
        String code,
        String inviteeRef,
        String inviteeName,
        String status,
        OffsetDateTime expiresAt,
        OffsetDateTime createdAt,
        UUID acceptedByUserId,
        OffsetDateTime acceptedAt
) {

    public static InvitationResponse from(HouseholdInvitation invitation) {
        return new InvitationResponse(
                invitation.getId(),
                invitation.getHousehold().getId(),
                invitation.getCode(),
                invitation.getInviteeRef(),
                invitation.getInviteeName(),
                invitation.getStatus().name(),
                invitation.getExpiresAt(),
                invitation.getCreatedAt(),
                invitation.getAcceptedByUserId(),
                invitation.getAcceptedAt()
        );
    }
}
