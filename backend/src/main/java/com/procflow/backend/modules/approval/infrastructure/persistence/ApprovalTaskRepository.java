package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.procflow.backend.modules.approval.domain.ApprovalTask;

public interface ApprovalTaskRepository extends JpaRepository<ApprovalTask, UUID> {

    Optional<ApprovalTask> findByIdAndTenantId(UUID id, UUID tenantId);

    /**
     * Owning instance of a task, read without loading the task so the instance can be locked first.
     */
    @Query("select t.approvalInstanceId from ApprovalTask t where t.id = :taskId and t.tenantId = :tenantId")
    Optional<UUID> findInstanceIdByTaskId(@Param("taskId") UUID taskId, @Param("tenantId") UUID tenantId);

    List<ApprovalTask> findByApprovalStageIdAndTenantId(UUID approvalStageId, UUID tenantId);

    List<ApprovalTask> findByApprovalInstanceIdAndTenantIdOrderByCreatedAtAsc(UUID approvalInstanceId, UUID tenantId);

    /**
     * Pending approver tasks of a principal whose stage is still waiting for decisions.
     */
    @Query(value = """
            select t from ApprovalTask t, ApprovalStage s
             where s.id = t.approvalStageId
               and t.tenantId = :tenantId
               and t.assigneePrincipalId = :principalId
               and t.status = com.procflow.backend.modules.approval.domain.ApprovalTaskStatus.PENDING
               and t.taskType = com.procflow.backend.modules.approval.domain.ApprovalTaskType.APPROVER
               and s.status = com.procflow.backend.modules.approval.domain.ApprovalStageStatus.PENDING
             order by t.dueAt asc nulls last, t.createdAt asc
            """,
            countQuery = """
            select count(t) from ApprovalTask t, ApprovalStage s
             where s.id = t.approvalStageId
               and t.tenantId = :tenantId
               and t.assigneePrincipalId = :principalId
               and t.status = com.procflow.backend.modules.approval.domain.ApprovalTaskStatus.PENDING
               and t.taskType = com.procflow.backend.modules.approval.domain.ApprovalTaskType.APPROVER
               and s.status = com.procflow.backend.modules.approval.domain.ApprovalStageStatus.PENDING
            """)
    Page<ApprovalTask> findActionableTasks(
            @Param("tenantId") UUID tenantId,
            @Param("principalId") String principalId,
            Pageable pageable);
}
