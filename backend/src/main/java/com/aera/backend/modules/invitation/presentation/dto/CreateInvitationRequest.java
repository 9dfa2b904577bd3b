package com.aera.backend.modules.invitation.presentation.dto;

import java.time.Duration;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param inviteeRef optional phone the invitation is bound to; separators are allowed, digits required
 * @param ttl optional ISO-8601 duration, e.g. {@code PT24H}
 */
public record CreateInvitationRequest(
        @Size(max = 32)
        @Pattern(regexp = "^\\s*$|^\\s*\\+?[0-9().\\-\\s]*[0-9][0-9().\\-\\s]*$", message = "must be a phone number")
        String inviteeRef,
        @Size(max = 120) String inviteeName,
        Duration ttl
) {
}
