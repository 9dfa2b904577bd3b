package com.aera.backend.modules.invitation.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.aera.backend.global.error.ProblemException;
import com.aera.backend.modules.audit.application.AuditLogService;
import com.aera.backend.modules.household.application.HouseholdCodeGenerator;
import com.aera.backend.modules.household.application.MembershipTransactionService;
import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;
import com.aera.backend.modules.household.domain.ShareCodeKind;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.invitation.domain.HouseholdInvitation;
import com.aera.backend.modules.invitation.domain.InvitationStatus;
import com.aera.backend.modules.invitation.infrastructure.persistence.HouseholdInvitationRepository;
import com.aera.backend.modules.invitation.presentation.dto.InvitationResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T00:00:00Z");
    private static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID REQUESTER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000b2");

    @Mock
    private HouseholdRepository householdRepository;

    @Mock
    private HouseholdMembershipRepository membershipRepository;

    @Mock
    private HouseholdInvitationRepository invitationRepository;

    @Mock
    private HouseholdCodeGenerator codeGenerator;

    @Mock
    private MembershipTransactionService membershipTransactionService;

    @Mock
    private AuditLogService auditLogService;

    private InvitationService service;
    private Household household;
    private UUID householdId;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        service = new InvitationService(
                householdRepository,
                membershipRepository,
                invitationRepository,
                codeGenerator,
                membershipTransactionService,
                auditLogService,
                clock,
                Duration.ofHours(72),
                Duration.ofDays(14)
        );
        householdId = UUID.randomUUID();
        household = new Household("Hill House", "HSE234");
        ReflectionTestUtils.setField(household, "id", householdId);
    }

    private void stubOwner() {
        when(membershipRepository.findByHouseholdIdAndRole(householdId, HouseholdRole.OWNER))
                .thenReturn(Optional.of(new HouseholdMembership(household, OWNER_ID, HouseholdRole.OWNER, NOW)));
    }

    private HouseholdInvitation invitation(OffsetDateTime expiresAt, String inviteeRef) {
        HouseholdInvitation invitation = new HouseholdInvitation(household, OWNER_ID, "INV234", inviteeRef, null, expiresAt);
        ReflectionTestUtils.setField(invitation, "id", UUID.randomUUID());
        return invitation;
    }

    private void stubSave() {
        when(invitationRepository.save(any(HouseholdInvitation.class))).thenAnswer(inv -> {
            HouseholdInvitation saved = inv.getArgument(0);
            ReflectionTestUtils.setField(saved, "id", UUID.randomUUID());
            return saved;
        });
    }

    @Test
    void createUsesDefaultTtl() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.of(household));
        stubOwner();
        when(codeGenerator.generate(ShareCodeKind.INVITATION)).thenReturn("INV234");
        stubSave();

        InvitationResponse response = service.createInvitation(householdId, OWNER_ID, null, null, null);

        assertThat(response.code()).isEqualTo("INV234");
        assertThat(response.status()).isEqualTo("PENDING");
        assertThat(response.expiresAt()).isEqualTo(NOW.plusHours(72));
    }

    @Test
    @DisplayName("requested ttl is capped at the configured maximum")
    void createCapsTtl() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.of(household));
        stubOwner();
        when(codeGenerator.generate(ShareCodeKind.INVITATION)).thenReturn("INV234");
        stubSave();

        InvitationResponse response = service.createInvitation(householdId, OWNER_ID, " +1 555 010 2000 ", "Kim", Duration.ofDays(30));

        assertThat(response.expiresAt()).isEqualTo(NOW.plusDays(14));
        assertThat(response.inviteeRef()).isEqualTo("+1 555 010 2000");
    }

    @Test
    void createRejectsNonPositiveTtl() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.of(household));
        stubOwner();

        assertThatThrownBy(() -> service.createInvitation(householdId, OWNER_ID, null, null, Duration.ZERO))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVALID_TTL");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
                });
        verify(codeGenerator, never()).generate(any());
    }

    @Test
    void createRejectsInviteeWithoutDigits() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.of(household));
        stubOwner();

        assertThatThrownBy(() -> service.createInvitation(householdId, OWNER_ID, "kim@example.com", "Kim", null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVALID_INVITEE");
                    assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
                });
        verify(codeGenerator, never()).generate(any());
        verify(invitationRepository, never()).save(any());
    }

    @Test
    void createRequiresOwner() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.of(household));
        stubOwner();

        assertThatThrownBy(() -> service.createInvitation(householdId, REQUESTER_ID, null, null, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOT_OWNER"));
    }

    @Test
    void createRejectsUnknownHousehold() {
        when(householdRepository.findById(householdId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.createInvitation(householdId, OWNER_ID, null, null, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOT_FOUND"));
    }

    @Test
    void redeemNormalizesCodeAndDelegatesToApproveJoin() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), null);
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("INV234")).thenReturn(Optional.of(invitation));

        service.redeemInvitation("  inv234 ", REQUESTER_ID, null);

        verify(membershipTransactionService).approveJoin(invitation.getId(), REQUESTER_ID, null);
    }

    @Test
    void redeemUnknownCode() {
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("NOPE23")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.redeemInvitation("nope23", REQUESTER_ID, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVITATION_NOT_FOUND");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                });
    }

    @Test
    void redeemUsedInvitation() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), null);
        invitation.accept(UUID.randomUUID(), NOW.minusHours(1));
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("INV234")).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> service.redeemInvitation("INV234", REQUESTER_ID, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVITATION_ALREADY_USED"));
        verify(membershipTransactionService, never()).approveJoin(any(), any(), any());
    }

    @Test
    void redeemRevokedInvitation() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), null);
        invitation.revoke();
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("INV234")).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> service.redeemInvitation("INV234", REQUESTER_ID, null))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INVITATION_REVOKED"));
    }

    @Test
    void redeemOverdueInvitation() {
        HouseholdInvitation invitation = invitation(NOW.minusMinutes(1), null);
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("INV234")).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> service.redeemInvitation("INV234", REQUESTER_ID, null))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVITATION_EXPIRED");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.GONE);
                });
    }

    @Test
    void redeemBoundInvitationWithOtherPhone() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), "+15550102000");
        when(invitationRepository.findFirstByCodeOrderByCreatedAtDesc("INV234")).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> service.redeemInvitation("INV234", REQUESTER_ID, "+15550100000"))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getCode()).isEqualTo("INVITEE_MISMATCH");
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                });
    }

    @Test
    void revokeReleasesCode() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), null);
        when(householdRepository.findByIdForUpdate(householdId)).thenReturn(Optional.of(household));
        stubOwner();
        when(invitationRepository.findByIdForUpdate(invitation.getId())).thenReturn(Optional.of(invitation));

        InvitationResponse response = service.revokeInvitation(householdId, invitation.getId(), OWNER_ID);

        assertThat(response.status()).isEqualTo("REVOKED");
        verify(codeGenerator).release("INV234");
    }

    @Test
    void revokeAcceptedInvitationIsAlreadyProcessed() {
        HouseholdInvitation invitation = invitation(NOW.plusDays(1), null);
        invitation.accept(REQUESTER_ID, NOW);
        when(householdRepository.findByIdForUpdate(householdId)).thenReturn(Optional.of(household));
        stubOwner();
        when(invitationRepository.findByIdForUpdate(invitation.getId())).thenReturn(Optional.of(invitation));

        assertThatThrownBy(() -> service.revokeInvitation(householdId, invitation.getId(), OWNER_ID))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("ALREADY_PROCESSED"));
        verify(codeGenerator, never()).release(anyString());
    }

    @Test
    void expirySweepExpiresOverdueInvitations() {
        HouseholdInvitation overdue = invitation(NOW.minusHours(1), null);
        when(invitationRepository.findOverduePendingIds(eq(NOW), any(Pageable.class))).thenReturn(List.of(overdue.getId()));
        when(invitationRepository.findByIdForUpdate(overdue.getId())).thenReturn(Optional.of(overdue));

        int expired = service.expireOverdueInvitations();

        assertThat(expired).isEqualTo(1);
        assertThat(overdue.getStatus()).isEqualTo(InvitationStatus.EXPIRED);
        verify(codeGenerator).release("INV234");
    }
}
