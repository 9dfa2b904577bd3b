package com.aera.backend.modules.household.presentation.dto;

import java.util.UUID;

public record TransferOwnershipResponse(
        boolean success,
        UUID householdId,
        UUID previousOwnerId,
        UUID newOwnerId
) {
}
