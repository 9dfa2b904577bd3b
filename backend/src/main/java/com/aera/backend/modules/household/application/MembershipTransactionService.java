package com.aera.backend.modules.household.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.aera.backend.global.error.ProblemException;
import com.aera.backend.modules.audit.application.AuditLogService;
import com.aera.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.aera.backend.modules.audit.application.AuditLogService.ComplianceCommand;
import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.household.presentation.dto.HouseholdDtoMapper;
import com.aera.backend.modules.household.presentation.dto.LeaveHouseholdResponse;
import com.aera.backend.modules.household.presentation.dto.MembershipResponse;
import com.aera.backend.modules.household.presentation.dto.TransferOwnershipResponse;
import com.aera.backend.modules.invitation.domain.HouseholdInvitation;
import com.aera.backend.modules.invitation.domain.InvitationStatus;
import com.aera.backend.modules.invitation.infrastructure.persistence.HouseholdInvitationRepository;
import com.aera.backend.modules.profile.application.UserProfileService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Approve-join, transfer-ownership and leave-household. Every operation locks the household
 * row before reading membership state; approve-join then locks the invitation row.
 */
@Service
@Transactional
public class MembershipTransactionService {

    private static final Logger log = LoggerFactory.getLogger(MembershipTransactionService.class);

    static final String ACTION_MEMBER_JOINED = "member_joined";
    static final String ACTION_OWNERSHIP_TRANSFERRED = "ownership_transferred";
    static final String ACTION_MEMBER_LEFT = "member_left";
    static final String ACTION_HOUSEHOLD_DELETED = "household_deleted";

    private final HouseholdRepository householdRepository;
    private final HouseholdMembershipRepository membershipRepository;
    private final HouseholdInvitationRepository invitationRepository;
    private final HouseholdCodeGenerator codeGenerator;
    private final AuditLogService auditLogService;
    private final UserProfileService userProfileService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public MembershipTransactionService(
            HouseholdRepository householdRepository,
            HouseholdMembershipRepository membershipRepository,
            HouseholdInvitationRepository invitationRepository,
            HouseholdCodeGenerator codeGenerator,
            AuditLogService auditLogService,
            UserProfileService userProfileService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.householdRepository = householdRepository;
        this.membershipRepository = membershipRepository;
        this.invitationRepository = invitationRepository;
        this.codeGenerator = codeGenerator;
        this.auditLogService = auditLogService;
        this.userProfileService = userProfileService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public MembershipResponse approveJoin(UUID invitationId, UUID requesterId, String requesterPhone) {
        // scalar lookup keeps the invitation out of the persistence context until it is locked
        UUID householdId = invitationRepository.findHouseholdIdById(invitationId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "invitation not found"));
        Household household = householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "household not found"));
        HouseholdInvitation invitation = invitationRepository.findByIdForUpdate(invitationId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "invitation not found"));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (!invitation.isPending()) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_PROCESSED", "invitation is already " + invitation.getStatus());
        }
        if (invitation.isExpiredAt(now)) {
            throw problem(HttpStatus.GONE, "INVITATION_EXPIRED", "invitation expired at " + invitation.getExpiresAt());
        }
        if (!invitation.acceptsInvitee(requesterPhone)) {
            throw problem(HttpStatus.FORBIDDEN, "INVITEE_MISMATCH", "invitation is bound to another invitee");
        }
        if (membershipRepository.existsByHouseholdIdAndUserId(householdId, requesterId)) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_MEMBER", "requester already belongs to this household");
        }

        invitation.accept(requesterId, now);
        HouseholdMembership membership = membershipRepository.save(
                new HouseholdMembership(household, requesterId, HouseholdRole.MEMBER, now));
        codeGenerator.release(invitation.getCode());

        Map<String, Object> detail = new HashMap<>();
        detail.put("invitationId", invitationId.toString());
        detail.put("inviterUserId", invitation.getInviterUserId().toString());
        writeAudit(householdId, requesterId, ACTION_MEMBER_JOINED, requesterId, detail);

        userProfileService.fillActiveHouseholdIfEmpty(requesterId, householdId);
        eventPublisher.publishEvent(new HouseholdMembershipChangedEvent(householdId, ACTION_MEMBER_JOINED));

        log.info("User {} joined household {} via invitation {}", requesterId, householdId, invitationId);
        UUID activeHouseholdId = userProfileService.findActiveHouseholdId(requesterId).orElse(null);
        return HouseholdDtoMapper.toMembershipResponse(membership, activeHouseholdId);
    }

    public TransferOwnershipResponse transferOwnership(UUID householdId, UUID newOwnerId, UUID actorId) {
        householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found"));
        HouseholdMembership currentOwner = membershipRepository.findByHouseholdIdAndRole(householdId, HouseholdRole.OWNER)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household has no owner"));

        if (!currentOwner.getUserId().equals(actorId)) {
            throw problem(HttpStatus.FORBIDDEN, "NOT_OWNER", "only the owner can transfer ownership");
        }
        if (newOwnerId.equals(actorId)) {
            throw problem(HttpStatus.UNPROCESSABLE_ENTITY, "SAME_IDENTITY", "new owner must differ from the current owner");
        }
        HouseholdMembership target = membershipRepository.findByHouseholdIdAndUserId(householdId, newOwnerId)
                .orElseThrow(() -> problem(HttpStatus.UNPROCESSABLE_ENTITY, "NOT_A_MEMBER", "new owner is not a member of this household"));
        if (membershipRepository.existsByUserIdAndRole(newOwnerId, HouseholdRole.OWNER)) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_OWNS_HOUSEHOLD", "new owner already owns a household");
        }

        // demote first: the one-owner index would reject the reverse order
        currentOwner.demote();
        membershipRepository.saveAndFlush(currentOwner);
        target.promote();
        membershipRepository.saveAndFlush(target);

        Map<String, Object> detail = new HashMap<>();
        detail.put("from", actorId.toString());
        detail.put("to", newOwnerId.toString());
        writeAudit(householdId, actorId, ACTION_OWNERSHIP_TRANSFERRED, newOwnerId, detail);

        userProfileService.fillActiveHouseholdIfEmpty(actorId, householdId);
        userProfileService.fillActiveHouseholdIfEmpty(newOwnerId, householdId);
        eventPublisher.publishEvent(new HouseholdMembershipChangedEvent(householdId, ACTION_OWNERSHIP_TRANSFERRED));

        log.info("Household {} ownership transferred from {} to {}", householdId, actorId, newOwnerId);
        return new TransferOwnershipResponse(true, householdId, actorId, newOwnerId);
    }

    /**
     * @param householdId optional scope; without it the active household is used
     */
    public LeaveHouseholdResponse leaveHousehold(UUID householdId, UUID actorId) {
        UUID targetHouseholdId = householdId != null ? householdId : resolveHouseholdToLeave(actorId);
        Household household = householdRepository.findByIdForUpdate(targetHouseholdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND", "no membership in this household"));
        HouseholdMembership membership = membershipRepository.findByHouseholdIdAndUserId(targetHouseholdId, actorId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND", "no membership in this household"));
        HouseholdRole role = membership.getRole();

        if (role == HouseholdRole.MEMBER) {
            membershipRepository.delete(membership);
            writeAudit(targetHouseholdId, actorId, ACTION_MEMBER_LEFT, actorId, Map.of("role", role.name()));
            userProfileService.clearActiveHousehold(actorId, targetHouseholdId);
            eventPublisher.publishEvent(new HouseholdMembershipChangedEvent(targetHouseholdId, ACTION_MEMBER_LEFT));

            log.info("User {} left household {}", actorId, targetHouseholdId);
            return new LeaveHouseholdResponse(true, targetHouseholdId, actorId, role.name(), false);
        }

        long otherMembers = membershipRepository.countByHouseholdId(targetHouseholdId) - 1;
        if (otherMembers > 0) {
            throw problem(HttpStatus.CONFLICT, "MUST_TRANSFER_FIRST",
                    "owner must transfer ownership before leaving; " + otherMembers + " member(s) remain");
        }

        deleteHousehold(household, membership, actorId);
        log.info("Household {} deleted after its sole owner {} left", targetHouseholdId, actorId);
        return new LeaveHouseholdResponse(true, targetHouseholdId, actorId, role.name(), true);
    }

    private void deleteHousehold(Household household, HouseholdMembership ownerMembership, UUID actorId) {
        UUID householdId = household.getId();

        // audit rows are keyed by a snapshot id, so they are written before the delete and survive it
        Map<String, Object> detail = new HashMap<>();
        detail.put("name", household.getName());
        detail.put("code", household.getCode());
        writeAudit(householdId, actorId, ACTION_HOUSEHOLD_DELETED, actorId, detail);

        userProfileService.clearActiveHousehold(actorId, householdId);
        List<String> pendingCodes = invitationRepository.findCodesByHouseholdIdAndStatus(householdId, InvitationStatus.PENDING);

        membershipRepository.delete(ownerMembership);
        invitationRepository.deleteByHouseholdId(householdId);
        householdRepository.delete(household);

        pendingCodes.forEach(codeGenerator::release);
        codeGenerator.release(household.getCode());
    }

    private UUID resolveHouseholdToLeave(UUID actorId) {
        List<UUID> householdIds = membershipRepository.findHouseholdIdsByUserId(actorId);
        if (householdIds.isEmpty()) {
            throw problem(HttpStatus.NOT_FOUND, "MEMBERSHIP_NOT_FOUND", "user has no household membership");
        }
        UUID activeHouseholdId = userProfileService.findActiveHouseholdId(actorId).orElse(null);
        if (activeHouseholdId != null && householdIds.contains(activeHouseholdId)) {
            return activeHouseholdId;
        }
        if (householdIds.size() == 1) {
            return householdIds.get(0);
        }
        throw problem(HttpStatus.BAD_REQUEST, "HOUSEHOLD_ID_REQUIRED", "user belongs to several households; specify householdId");
    }

    private void writeAudit(UUID householdId, UUID actorId, String action, UUID targetUserId, Map<String, Object> detail) {
        auditLogService.record(new AuditLogCommand(householdId, actorId, action, targetUserId, detail));
        auditLogService.recordCompliance(new ComplianceCommand(
                userProfileService.findOrganizationId(actorId),
                actorId,
                action,
                AuditLogService.ENTITY_HOUSEHOLD,
                householdId.toString(),
                detail
        ));
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
