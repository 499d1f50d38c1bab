package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.procflow.backend.modules.approval.domain.ApprovalAssignmentSnapshot;

public interface ApprovalAssignmentSnapshotRepository extends JpaRepository<ApprovalAssignmentSnapshot, UUID> {

    Optional<ApprovalAssignmentSnapshot> findByApprovalInstanceIdAndTenantIdAndStageNo(
            UUID approvalInstanceId,
            UUID tenantId,
            int stageNo);

    List<ApprovalAssignmentSnapshot> findByApprovalInstanceIdAndTenantIdOrderByStageNoAsc(
            UUID approvalInstanceId,
            UUID tenantId);
}
