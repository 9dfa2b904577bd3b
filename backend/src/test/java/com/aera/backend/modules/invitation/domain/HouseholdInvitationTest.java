package com.aera.backend.modules.invitation.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.aera.backend.modules.household.domain.Household;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HouseholdInvitationTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T12:00:00Z");

    private HouseholdInvitation invitation(String inviteeRef) {
        return new HouseholdInvitation(
                new Household("Hill House", "ABCDEF"),
                UUID.randomUUID(),
                "QWERTY",
                inviteeRef,
                null,
                NOW.plusHours(1)
        );
    }

    @Test
    void acceptRecordsAcceptingUser() {
        HouseholdInvitation invitation = invitation(null);
        UUID userId = UUID.randomUUID();

        invitation.accept(userId, NOW);

        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.ACCEPTED);
        assertThat(invitation.getAcceptedByUserId()).isEqualTo(userId);
        assertThat(invitation.getAcceptedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("a terminal invitation never returns to another status")
    void terminalStatusIsFinal() {
        HouseholdInvitation invitation = invitation(null);
        invitation.revoke();

        assertThatThrownBy(() -> invitation.accept(UUID.randomUUID(), NOW)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(invitation::expire).isInstanceOf(IllegalStateException.class);
        assertThat(invitation.getStatus()).isEqualTo(InvitationStatus.REVOKED);
    }

    @Test
    void pendingInvitationExpiresAtDeadline() {
        HouseholdInvitation invitation = invitation(null);

        assertThat(invitation.isExpiredAt(NOW)).isFalse();
        assertThat(invitation.isExpiredAt(NOW.plusHours(1))).isTrue();
    }

    @Test
    @DisplayName("bound invitations compare phone digits only")
    void boundInvitationMatchesDigits() {
        HouseholdInvitation invitation = invitation("+1 (555) 010-2000");

        assertThat(invitation.isBound()).isTrue();
        assertThat(invitation.acceptsInvitee("15550102000")).isTrue();
        assertThat(invitation.acceptsInvitee("+1-555-010-2001")).isFalse();
        assertThat(invitation.acceptsInvitee(null)).isFalse();
    }

    @Test
    void unboundInvitationAcceptsAnyone() {
        HouseholdInvitation invitation = invitation(" ");

        assertThat(invitation.isBound()).isFalse();
        assertThat(invitation.acceptsInvitee(null)).isTrue();
    }
}
