package com.aera.backend.modules.household.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdMembership;

public final class HouseholdDtoMapper {

    private HouseholdDtoMapper() {
    }

    public static HouseholdResponse toHouseholdResponse(Household household, List<HouseholdMembership> memberships) {
        List<HouseholdMemberResponse> members = memberships.stream()
                .map(HouseholdDtoMapper::toMemberResponse)
                .toList();
        return new HouseholdResponse(
                household.getId(),
                household.getName(),
                household.getCode(),
                household.getCreatedAt(),
                members
        );
    }

    public static HouseholdMemberResponse toMemberResponse(HouseholdMembership membership) {
        return new HouseholdMemberResponse(
                membership.getUserId(),
                membership.getRole().name(),
                membership.getJoinedAt()
        );
    }

    public static MembershipResponse toMembershipResponse(HouseholdMembership membership, UUID activeHouseholdId) {
        Household household = membership.getHousehold();
        return new MembershipResponse(
                household.getId(),
                household.getName(),
                household.getCode(),
                membership.getUserId(),
                membership.getRole().name(),
                membership.getJoinedAt(),
                household.getId().equals(activeHouseholdId)
        );
    }
}
