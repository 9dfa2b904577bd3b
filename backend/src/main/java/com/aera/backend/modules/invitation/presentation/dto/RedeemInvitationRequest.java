package com.aera.backend.modules.invitation.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RedeemInvitationRequest(@NotBlank @Size(max = 16) String code) {
}
