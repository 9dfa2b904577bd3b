package com.aera.backend.modules.invitation.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.aera.backend.global.error.ProblemException;
import com.aera.backend.modules.audit.application.AuditLogService;
import com.aera.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.aera.backend.modules.household.application.HouseholdCodeGenerator;
import com.aera.backend.modules.household.application.MembershipTransactionService;
import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;
import com.aera.backend.modules.household.domain.ShareCodeKind;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.household.presentation.dto.MembershipResponse;
import com.aera.backend.modules.invitation.domain.HouseholdInvitation;
import com.aera.backend.modules.invitation.domain.InviteePhone;
import com.aera.backend.modules.invitation.infrastructure.persistence.HouseholdInvitationRepository;
import com.aera.backend.modules.invitation.presentation.dto.InvitationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class InvitationService {

    private static final Logger log = LoggerFactory.getLogger(InvitationService.class);

    static final String ACTION_INVITATION_CREATED = "invitation_created";
    static final String ACTION_INVITATION_REVOKED = "invitation_revoked";
    private static final int EXPIRY_BATCH_SIZE = 200;

    private final HouseholdRepository householdRepository;
    private final HouseholdMembershipRepository membershipRepository;
    private final HouseholdInvitationRepository invitationRepository;
    private final HouseholdCodeGenerator codeGenerator;
    private final MembershipTransactionService membershipTransactionService;
    private final AuditLogService auditLogService;
    private final Clock clock;
    private final Duration defaultTtl;
    private final Duration maxTtl;

    public InvitationService(
            HouseholdRepository householdRepository,
            HouseholdMembershipRepository membershipRepository,
            HouseholdInvitationRepository invitationRepository,
            HouseholdCodeGenerator codeGenerator,
            MembershipTransactionService membershipTransactionService,
            AuditLogService auditLogService,
            Clock clock,
            @Value("${app.invitation.default-ttl:PT72H}") Duration defaultTtl,
            @Value("${app.invitation.max-ttl:P14D}") Duration maxTtl
    ) {
        this.householdRepository = householdRepository;
        this.membershipRepository = membershipRepository;
        this.invitationRepository = invitationRepository;
        this.codeGenerator = codeGenerator;
        this.membershipTransactionService = membershipTransactionService;
        this.auditLogService = auditLogService;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        this.maxTtl = maxTtl;
    }

    public InvitationResponse createInvitation(
            UUID householdId,
            UUID inviterId,
            String inviteeRef,
            String inviteeName,
            Duration ttl
    ) {
        Household household = householdRepository.findById(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found"));
        requireOwner(householdId, inviterId);
        String boundPhone = resolveInvitee(inviteeRef);

        Duration effectiveTtl = resolveTtl(ttl);
        OffsetDateTime expiresAt = OffsetDateTime.now(clock).plus(effectiveTtl);
        String code = codeGenerator.generate(ShareCodeKind.INVITATION);

        HouseholdInvitation invitation = invitationRepository.save(new HouseholdInvitation(
                household,
                inviterId,
                code,
                boundPhone,
                StringUtils.hasText(inviteeName) ? inviteeName.trim() : null,
                expiresAt
        ));

        Map<String, Object> detail = new HashMap<>();
        detail.put("invitationId", invitation.getId().toString());
        detail.put("expiresAt", expiresAt.toString());
        detail.put("bound", invitation.isBound());
        auditLogService.record(new AuditLogCommand(householdId, inviterId, ACTION_INVITATION_CREATED, null, detail));

        log.info("Invitation {} created for household {} (expires {})", invitation.getId(), householdId, expiresAt);
        return InvitationResponse.from(invitation);
    }

    /**
     * Validates the code with plain reads, then hands the mutation to approve-join, which
     * re-checks everything under row locks. The loser of a race gets {@code ALREADY_PROCESSED}.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public MembershipResponse redeemInvitation(String rawCode, UUID requesterId, String requesterPhone) {
        String code = rawCode == null ? "" : rawCode.trim().toUpperCase(Locale.ROOT);
        HouseholdInvitation invitation = invitationRepository.findFirstByCodeOrderByCreatedAtDesc(code)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "INVITATION_NOT_FOUND", "no invitation with this code"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        switch (invitation.getStatus()) {
            case ACCEPTED -> throw problem(HttpStatus.CONFLICT, "INVITATION_ALREADY_USED", "invitation has already been used");
            case REVOKED -> throw problem(HttpStatus.CONFLICT, "INVITATION_REVOKED", "invitation was revoked");
            case EXPIRED -> throw problem(HttpStatus.GONE, "INVITATION_EXPIRED", "invitation has expired");
            case PENDING -> {
                if (invitation.isExpiredAt(now)) {
                    throw problem(HttpStatus.GONE, "INVITATION_EXPIRED", "invitation has expired");
                }
            }
        }
        if (!invitation.acceptsInvitee(requesterPhone)) {
            throw problem(HttpStatus.FORBIDDEN, "INVITEE_MISMATCH", "invitation is bound to another invitee");
        }

        return membershipTransactionService.approveJoin(invitation.getId(), requesterId, requesterPhone);
    }

    public InvitationResponse revokeInvitation(UUID householdId, UUID invitationId, UUID actorId) {
        householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found"));
        requireOwner(householdId, actorId);
        HouseholdInvitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .filter(candidate -> candidate.getHousehold().getId().equals(householdId))
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "INVITATION_NOT_FOUND", "invitation not found"));
        if (!invitation.isPending()) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_PROCESSED", "invitation is already " + invitation.getStatus());
        }

        invitation.revoke();
        codeGenerator.release(invitation.getCode());
        auditLogService.record(new AuditLogCommand(
                householdId,
                actorId,
                ACTION_INVITATION_REVOKED,
                null,
                Map.of("invitationId", invitationId.toString())
        ));

        log.info("Invitation {} revoked by {}", invitationId, actorId);
        return InvitationResponse.from(invitation);
    }

    /**
     * Moves overdue PENDING invitations to EXPIRED and frees their codes.
     *
     * @return number of invitations expired
     */
    public int expireOverdueInvitations() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<UUID> overdueIds = invitationRepository.findOverduePendingIds(now, PageRequest.of(0, EXPIRY_BATCH_SIZE));
        int expired = 0;
        for (UUID invitationId : overdueIds) {
            HouseholdInvitation invitation = invitationRepository.findByIdForUpdate(invitationId).orElse(null);
            if (invitation == null || !invitation.isPending()) {
                continue;
            }
            invitation.expire();
            codeGenerator.release(invitation.getCode());
            expired++;
        }
        return expired;
    }

    private void requireOwner(UUID householdId, UUID userId) {
        boolean owner = membershipRepository.findByHouseholdIdAndRole(householdId, HouseholdRole.OWNER)
                .map(HouseholdMembership::getUserId)
                .filter(userId::equals)
                .isPresent();
        if (!owner) {
            throw problem(HttpStatus.FORBIDDEN, "NOT_OWNER", "only the household owner can manage invitations");
        }
    }

    // a bound invitation with no digits could never match a redeemer's phone
    private String resolveInvitee(String inviteeRef) {
        if (!StringUtils.hasText(inviteeRef)) {
            return null;
        }
        if (InviteePhone.normalize(inviteeRef).isEmpty()) {
            throw problem(HttpStatus.BAD_REQUEST, "INVALID_INVITEE", "inviteeRef must be a phone number");
        }
        return inviteeRef.trim();
    }

    private Duration resolveTtl(Duration requested) {
        if (requested == null) {
            return defaultTtl;
        }
        if (requested.isZero() || requested.isNegative()) {
            throw problem(HttpStatus.BAD_REQUEST, "INVALID_TTL", "ttl must be positive");
        }
        return requested.compareTo(maxTtl) > 0 ? maxTtl : requested;
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
