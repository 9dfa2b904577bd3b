package com.aera.backend.modules.readiness.application;

import java.util.UUID;

public record ReadinessInput(UUID householdId, int memberCount) {
}
