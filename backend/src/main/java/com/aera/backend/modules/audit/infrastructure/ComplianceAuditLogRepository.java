package com.aera.backend.modules.audit.infrastructure;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.aera.backend.modules.audit.domain.ComplianceAuditLog;

public interface ComplianceAuditLogRepository extends JpaRepository<ComplianceAuditLog, UUID> {

    List<ComplianceAuditLog> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(String entityType, String entityId);
}
