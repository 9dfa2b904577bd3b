package com.aera.backend.modules.household.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record JoinByCodeRequest(@NotBlank @Size(max = 16) String householdCode) {
}
