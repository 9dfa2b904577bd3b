package com.aera.backend.modules.household.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.aera.backend.global.error.ProblemException;
import com.aera.backend.modules.audit.application.AuditLogService;
import com.aera.backend.modules.audit.application.AuditLogService.AuditLogCommand;
import com.aera.backend.modules.audit.application.AuditLogService.ComplianceCommand;
import com.aera.backend.modules.household.domain.Household;
import com.aera.backend.modules.household.domain.HouseholdMembership;
import com.aera.backend.modules.household.domain.HouseholdRole;
import com.aera.backend.modules.household.domain.ShareCodeKind;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdMembershipRepository;
import com.aera.backend.modules.household.infrastructure.persistence.HouseholdRepository;
import com.aera.backend.modules.household.presentation.dto.HouseholdDtoMapper;
import com.aera.backend.modules.household.presentation.dto.HouseholdResponse;
import com.aera.backend.modules.household.presentation.dto.MembershipListResponse;
import com.aera.backend.modules.household.presentation.dto.MembershipResponse;
import com.aera.backend.modules.profile.application.UserProfileService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class HouseholdRegistryService {

    private static final Logger log = LoggerFactory.getLogger(HouseholdRegistryService.class);

    static final String ACTION_HOUSEHOLD_CREATED = "household_created";

    private final HouseholdRepository householdRepository;
    private final HouseholdMembershipRepository membershipRepository;
    private final HouseholdCodeGenerator codeGenerator;
    private final AuditLogService auditLogService;
    private final UserProfileService userProfileService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public HouseholdRegistryService(
            HouseholdRepository householdRepository,
            HouseholdMembershipRepository membershipRepository,
            HouseholdCodeGenerator codeGenerator,
            AuditLogService auditLogService,
            UserProfileService userProfileService,
            ApplicationEventPublisher eventPublisher,
            Clock clock
    ) {
        this.householdRepository = householdRepository;
        this.membershipRepository = membershipRepository;
        this.codeGenerator = codeGenerator;
        this.auditLogService = auditLogService;
        this.userProfileService = userProfileService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public HouseholdResponse createHousehold(UUID ownerId, String name) {
        if (membershipRepository.existsByUserIdAndRole(ownerId, HouseholdRole.OWNER)) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_OWNS_HOUSEHOLD", "user already owns a household");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        String code = codeGenerator.generate(ShareCodeKind.HOUSEHOLD);

        Household household = householdRepository.save(new Household(name.trim(), code));
        HouseholdMembership ownerMembership;
        try {
            ownerMembership = membershipRepository.saveAndFlush(
                    new HouseholdMembership(household, ownerId, HouseholdRole.OWNER, now));
        } catch (DataIntegrityViolationException ex) {
            throw problem(HttpStatus.CONFLICT, "ALREADY_OWNS_HOUSEHOLD", "user already owns a household");
        }

        Map<String, Object> detail = Map.of("name", household.getName(), "code", code);
        auditLogService.record(new AuditLogCommand(household.getId(), ownerId, ACTION_HOUSEHOLD_CREATED, ownerId, detail));
        auditLogService.recordCompliance(new ComplianceCommand(
                userProfileService.findOrganizationId(ownerId),
                ownerId,
                ACTION_HOUSEHOLD_CREATED,
                AuditLogService.ENTITY_HOUSEHOLD,
                household.getId().toString(),
                detail
        ));
        userProfileService.fillActiveHouseholdIfEmpty(ownerId, household.getId());
        eventPublisher.publishEvent(new HouseholdMembershipChangedEvent(household.getId(), ACTION_HOUSEHOLD_CREATED));

        log.info("Household {} created by {}", household.getId(), ownerId);
        return HouseholdDtoMapper.toHouseholdResponse(household, List.of(ownerMembership));
    }

    /**
     * The membership of the active household, falling back to the earliest joined one.
     */
    @Transactional(readOnly = true)
    public Optional<MembershipResponse> getMembership(UUID userId) {
        List<HouseholdMembership> memberships = membershipRepository.findAllByUserIdWithHousehold(userId);
        if (memberships.isEmpty()) {
            return Optional.empty();
        }
        UUID activeHouseholdId = userProfileService.findActiveHouseholdId(userId).orElse(null);
        HouseholdMembership selected = memberships.stream()
                .filter(membership -> membership.getHousehold().getId().equals(activeHouseholdId))
                .findFirst()
                .orElseGet(() -> memberships.stream()
                        .min(Comparator.comparing(HouseholdMembership::getJoinedAt))
                        .orElseThrow());
        return Optional.of(HouseholdDtoMapper.toMembershipResponse(selected, activeHouseholdId));
    }

    @Transactional(readOnly = true)
    public MembershipListResponse listMemberships(UUID userId) {
        UUID activeHouseholdId = userProfileService.findActiveHouseholdId(userId).orElse(null);
        List<MembershipResponse> items = membershipRepository.findAllByUserIdWithHousehold(userId).stream()
                .map(membership -> HouseholdDtoMapper.toMembershipResponse(membership, activeHouseholdId))
                .toList();
        return new MembershipListResponse(items);
    }

    @Transactional(readOnly = true)
    public HouseholdResponse getHousehold(UUID householdId, UUID requesterId) {
        Household household = householdRepository.findById(householdId)
                .orElseThrow(() -> problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found"));
        List<HouseholdMembership> memberships = membershipRepository.findAllByHouseholdIdOrderByJoinedAt(householdId);
        boolean member = memberships.stream().anyMatch(membership -> membership.getUserId().equals(requesterId));
        if (!member) {
            throw problem(HttpStatus.FORBIDDEN, "NOT_A_MEMBER", "requester is not a member of this household");
        }
        return HouseholdDtoMapper.toHouseholdResponse(household, memberships);
    }

    public MembershipResponse switchActiveHousehold(UUID householdId, UUID requesterId) {
        if (!householdRepository.existsById(householdId)) {
            throw problem(HttpStatus.NOT_FOUND, "NOT_FOUND", "household not found");
        }
        HouseholdMembership membership = membershipRepository.findByHouseholdIdAndUserId(householdId, requesterId)
                .orElseThrow(() -> problem(HttpStatus.FORBIDDEN, "NOT_A_MEMBER", "requester is not a member of this household"));
        userProfileService.switchActiveHousehold(requesterId, householdId);
        return HouseholdDtoMapper.toMembershipResponse(membership, householdId);
    }

    private ProblemException problem(HttpStatus status, String code, String detail) {
        return new ProblemException(status, code, detail);
    }
}
