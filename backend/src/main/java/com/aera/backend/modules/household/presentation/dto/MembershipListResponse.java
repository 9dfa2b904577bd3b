package com.aera.backend.modules.household.presentation.dto;

import java.util.List;

public record MembershipListResponse(List<MembershipResponse> items) {
}
