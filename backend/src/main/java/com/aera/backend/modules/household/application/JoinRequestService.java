package com.aera.backend.modules.household.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.aera.backend.global.error.ProblemException;
import com.aera.backend.modules.audit.application.AuditLogService;
import com.aera.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.aera.backend.modules.audit.application.AuditLogService.ComplianceCommand;
import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdJoinRequest;
import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;
import com.aera.backend.modules.household.domain.JoinRequestStatus;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdJoinRequestRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.household.presentation.dto.JoinRequestResponse;
import com.aera.backend.modules.profile.application.UserProfileService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Join by household code with owner consent. Submitting and deciding both lock the household
 * row first; a decision then locks the request row, so two owner clicks cannot both apply.
 */
@Service
@Transactional
public class JoinRequestService {

    private static final Logger log = LoggerFactory.getLogger(JoinRequestService.class);

    static final String ACTION_JOIN_REQUESTED = "join_request_submitted";
    static final String ACTION_JOIN_REJECTED = "join_request_rejected";

    private final HouseholdRepository householdRepository;
    private final HouseholdMembershipRepository membershipRepository;
    private final HouseholdJoinRequestRepository joinRequestRepository;
    private final AuditLogService auditLogService;
    private final UserProfileService userProfileService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public JoinRequestService(
            HouseholdRepository householdRepository,
            HouseholdMembershipRepository membershipRepository,
            HouseholdJoinRequestRepository joinRequestRepository,
            AuditLogService auditLogService,
            UserProfileService userProfileService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.householdRepository = householdRepository;
        this.membershipRepository = membershipRepository;
        this.joinRequestRepository = joinRequestRepository;
        this.auditLogService = auditLogService;
        this.userProfileService = userProfileService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * Repeating the call while a request is open returns that request with {@code created = false}.
     */
    public JoinRequestSubmission requestJoin(String rawCode, UUID requesterId) {
        String code = rawCode == null ? "" : rawCode.trim().toUpperCase(Locale.ROOT);
        UUID householdId = householdRepository.findIdByCode(code)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "HOUSEHOLD_NOT_FOUND", "no household with this code"));
        Household household = householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "HOUSEHOLD_NOT_FOUND", "no household with this code"));

        if (membershipRepository.existsByHouseholdIdAndUserId(householdId, requesterId)) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_MEMBER", "requester already belongs to this household");
        }
        Optional<HouseholdJoinRequest> open = joinRequestRepository.findPending(householdId, requesterId);
        if (open.isPresent()) {
            return new JoinRequestSubmission(JoinRequestResponse.from(open.get()), false);
        }

        HouseholdJoinRequest request = joinRequestRepository.save(new HouseholdJoinRequest(household, requesterId));
        UUID ownerId = membershipRepository.findByHouseholdIdAndRole(householdId, HouseholdRole.OWNER)
                .map(HouseholdMembership::getUserId)
                .orElse(null);
        auditLogService.record(new AuditLogCommand(
                householdId,
                requesterId,
                ACTION_JOIN_REQUESTED,
                ownerId,
                Map.of("joinRequestId", request.getId().toString())
        ));

        log.info("User {} requested to join household {} (request {})", requesterId, householdId, request.getId());
        return new JoinRequestSubmission(JoinRequestResponse.from(request), true);
    }

    public JoinRequestResponse approve(UUID householdId, UUID requestId, UUID actorId) {
        Household household = lockHousehold(householdId, requestId);
        requireOwner(householdId, actorId);
        HouseholdJoinRequest request = lockPendingRequest(requestId);
        UUID requesterId = request.getRequesterUserId();
        if (membershipRepository.existsByHouseholdIdAndUserId(householdId, requesterId)) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_MEMBER", "requester already belongs to this household");
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        request.approve(actorId, now);
        membershipRepository.save(new HouseholdMembership(household, requesterId, HouseholdRole.MEMBER, now));

        Map<String, Object> detail = new HashMap<>();
        detail.put("joinRequestId", requestId.toString());
        detail.put("approvedBy", actorId.toString());
        auditLogService.record(new AuditLogCommand(
                householdId, actorId, MembershipTransactionService.ACTION_MEMBER_JOINED, requesterId, detail));
        auditLogService.recordCompliance(new ComplianceCommand(
                userProfileService.findOrganizationId(actorId),
                actorId,
                MembershipTransactionService.ACTION_MEMBER_JOINED,
                AuditLogService.ENTITY_HOUSEHOLD,
                householdId.toString(),
                detail
        ));

        userProfileService.fillActiveHouseholdIfEmpty(requesterId, householdId);
        eventPublisher.publishEvent(
                new HouseholdMembershipChangedEvent(householdId, MembershipTransactionService.ACTION_MEMBER_JOINED));

        log.info("Owner {} approved join request {}; user {} joined household {}", actorId, requestId, requesterId, householdId);
        return JoinRequestResponse.from(request);
    }

    public JoinRequestResponse reject(UUID householdId, UUID requestId, UUID actorId) {
        lockHousehold(householdId, requestId);
        requireOwner(householdId, actorId);
        HouseholdJoinRequest request = lockPendingRequest(requestId);

        request.reject(actorId, OffsetDateTime.now(clock));
        auditLogService.record(new AuditLogCommand(
                householdId,
                actorId,
                ACTION_JOIN_REJECTED,
                request.getRequesterUserId(),
                Map.of("joinRequestId", requestId.toString())
        ));

        log.info("Owner {} rejected join request {} for household {}", actorId, requestId, householdId);
        return JoinRequestResponse.from(request);
    }

    @Transactional(readOnly = true)
    public List<JoinRequestResponse> listPending(UUID householdId, UUID actorId) {
        householdRepository.findById(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found"));
        requireOwner(householdId, actorId);
        return joinRequestRepository.findByHouseholdIdAndStatus(householdId, JoinRequestStatus.PENDING).stream()
                .map(JoinRequestResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<JoinRequestResponse> listOwn(UUID requesterId) {
        return joinRequestRepository.findAllByRequesterWithHousehold(requesterId).stream()
                .map(JoinRequestResponse::from)
                .toList();
    }

    // scalar lookup keeps the request out of the persistence context until it is locked
    private Household lockHousehold(UUID householdId, UUID requestId) {
        joinRequestRepository.findHouseholdIdById(requestId)
                .filter(householdId::equals)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "join request not found"));
        return householdRepository.findByIdForUpdate(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "household not found"));
    }

    private HouseholdJoinRequest lockPendingRequest(UUID requestId) {
        HouseholdJoinRequest request = joinRequestRepository.findByIdForUpdate(requestId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "REQUEST_NOT_FOUND", "join request not found"));
        if (!request.isPending()) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_PROCESSED", "join request is already " + request.getStatus());
        }
        return request;
    }

    private void requireOwner(UUID householdId, UUID userId) {
        boolean owner = membershipRepository.findByHouseholdIdAndRole(householdId, HouseholdRole.OWNER)
                .map(HouseholdMembership::getUserId)
                .filter(userId::equals)
                .isPresent();
        if (!owner) {
            throw problem(HttpStatus.FORBIDDEN, "NOT_OWNER", "only the household owner can resolve join requests");
        }
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }

    public record JoinRequestSubmission(JoinRequestResponse request, boolean created) {
    }
}
