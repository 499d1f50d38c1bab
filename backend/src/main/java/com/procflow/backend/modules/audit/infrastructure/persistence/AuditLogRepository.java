package com.procflow.backend.modules.audit.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByTenantIdAndResourceTypeAndResourceKeyOrderByCreatedAtAsc(
            UUID tenantId,
            String resourceType,
            String resourceKey);
}
