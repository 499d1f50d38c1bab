package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.approval.domain.ApprovalTemplateStage;

public interface ApprovalTemplateStageRepository extends JpaRepository<ApprovalTemplateStage, UUID> {

    List<ApprovalTemplateStage> findByApprovalTemplateIdAndTenantIdOrderByStageNoAsc(UUID approvalTemplateId,
                                                                                    UUID tenantId);
}
