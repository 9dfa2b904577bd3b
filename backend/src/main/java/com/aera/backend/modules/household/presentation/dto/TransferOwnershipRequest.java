package com.aera.backend.modules.household.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record TransferOwnershipRequest(@NotNull UUID newOwnerId) {
}
