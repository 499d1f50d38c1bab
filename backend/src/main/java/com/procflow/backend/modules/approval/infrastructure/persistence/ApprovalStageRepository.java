package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.approval.domain.ApprovalStage;

public interface ApprovalStageRepository extends JpaRepository<ApprovalStage, UUID> {

    Optional<ApprovalStage> findByIdAndTenantId(UUID id, UUID tenantId);

    List<ApprovalStage> findByApprovalInstanceIdAndTenantIdOrderByStageNoAsc(UUID approvalInstanceId, UUID tenantId);
}
