package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.approval.domain.ApprovalTemplate;

public interface ApprovalTemplateRepository extends JpaRepository<ApprovalTemplate, UUID> {

    Optional<ApprovalTemplate> findByIdAndTenantId(UUID id, UUID tenantId);
}
