package com.aera.backend.modules.household.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HouseholdRoleTest {

    @Test
    @DisplayName("MEMBER promotes to OWNER and OWNER demotes to MEMBER")
    void validTransitions() {
        assertThat(HouseholdRole.MEMBER.promote()).isEqualTo(HouseholdRole.OWNER);
        assertThat(HouseholdRole.OWNER.demote()).isEqualTo(HouseholdRole.MEMBER);
    }

    @Test
    void ownerCannotBePromoted() {
        assertThatThrownBy(HouseholdRole.OWNER::promote).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void memberCannotBeDemoted() {
        assertThatThrownBy(HouseholdRole.MEMBER::demote).isInstanceOf(IllegalStateException.class);
    }
}
