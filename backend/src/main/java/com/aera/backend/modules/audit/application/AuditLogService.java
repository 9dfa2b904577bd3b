package com.aera.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.aera.backend.global.web.RequestIdFilter;
import com.aera.backend.modules.audit.domain.ComplianceAuditLog;
import com.aera.backend.modules.audit.domain.HouseholdAuditLog;
import com.aera.backend.modules.audit.infrastructure.ComplianceAuditLogRepository;
import com.aera.backend.modules.audit.infrastructure.HouseholdAuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes audit and compliance entries inside the caller's transaction, so an entry exists
 * exactly when the membership change it describes commits.
 */
@Service
public class AuditLogService {

    public static final String ENTITY_HOUSEHOLD = "household";

    private final HouseholdAuditLogRepository auditLogRepository;
    private final ComplianceAuditLogRepository complianceAuditLogRepository;
    private final Clock clock;

    public AuditLogService(
            HouseholdAuditLogRepository auditLogRepository,
            ComplianceAuditLogRepository complianceAuditLogRepository,
            Clock clock
    ) {
        this.auditLogRepository = auditLogRepository;
        this.complianceAuditLogRepository = complianceAuditLogRepository;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.householdId(), "householdId is required");
        Objects.requireNonNull(command.actorUserId(), "actorUserId is required");
        Objects.requireNonNull(command.action(), "action is required");

        HouseholdAuditLog auditLog = new HouseholdAuditLog();
        auditLog.setHouseholdId(command.householdId());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setAction(command.action());
        auditLog.setTargetUserId(command.targetUserId());
        auditLog.setRequestId(RequestIdFilter.currentRequestId());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordCompliance(ComplianceCommand command) {
        Objects.requireNonNull(command.actorUserId(), "actorUserId is required");
        Objects.requireNonNull(command.action(), "action is required");
        Objects.requireNonNull(command.entityType(), "entityType is required");
        Objects.requireNonNull(command.entityId(), "entityId is required");

        ComplianceAuditLog entry = new ComplianceAuditLog();
        entry.setOrganizationId(command.organizationId());
        entry.setActorUserId(command.actorUserId());
        entry.setAction(command.action());
        entry.setEntityType(command.entityType());
        entry.setEntityId(command.entityId());
        entry.setCreatedAt(OffsetDateTime.now(clock));

        if (command.detail() != null && !command.detail().isEmpty()) {
            entry.setDetail(new HashMap<>(command.detail()));
        }

        complianceAuditLogRepository.save(entry);
    }

    public record AuditLogCommand(
            UUID householdId,
            UUID actorUserId,
            String action,
            UUID targetUserId,
            Map<String, Object> detail
    ) {
    }

    public record ComplianceCommand(
            UUID organizationId,
            UUID actorUserId,
            String action,
            String entityType,
            String entityId,
            Map<String, Object> detail
    ) {
    }
}
