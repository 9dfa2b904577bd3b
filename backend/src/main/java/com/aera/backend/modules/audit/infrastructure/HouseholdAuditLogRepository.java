package com.aera.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.aera.backend.modules.audit.domain.HouseholdAuditLog;

public interface HouseholdAuditLogRepository extends JpaRepository<HouseholdAuditLog, UUID> {

    List<HouseholdAuditLog> findByHouseholdIdOrderByCreatedAtAsc(UUID householdId);
}
