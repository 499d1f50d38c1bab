package com.procflow.backend.modules.approval.presentation.dto;

import java.util.List;

import com.procflow.backend.modules.approval.application.ApprovalDecisionResult;
import com.procflow.backend.modules.approval.domain.ApprovalAssignmentSnapshot;
import com.procflow.backend.modules.approval.domain.ApprovalEvent;
import com.procflow.backend.modules.approval.domain.ApprovalInstance;
import com.procflow.backend.modules.approval.domain.ApprovalStage;
import com.procflow.backend.modules.approval.domain.ApprovalStatusMapper;
import com.procflow.backend.modules.approval.domain.ApprovalTask;

public final class ApprovalDtoMapper {

    private ApprovalDtoMapper() {
    }

    public static ApprovalInstanceResponse toInstanceResponse(ApprovalInstance instance, List<ApprovalStage> stages) {
        Object reason = instance.getContext() != null ? instance.getContext().get(ApprovalInstance.CONTEXT_REASON) : null;
        return new ApprovalInstanceResponse(
                instance.getId(),
                instance.getEntityName(),
                instance.getEntityId(),
                instance.getTransitionId(),
                instance.getApprovalTemplateId(),
                ApprovalStatusMapper.toExternalStatus(instance),
                reason != null ? reason.toString() : null,
                instance.getCreatedBy(),
                instance.getCreatedAt(),
                instance.getClosedAt(),
                stages.stream().map(ApprovalDtoMapper::toStageResponse).toList()
        );
    }

    public static ApprovalStageResponse toStageResponse(ApprovalStage stage) {
        return new ApprovalStageResponse(
                stage.getId(),
                stage.getStageNo(),
                stage.getName(),
                stage.getMode(),
                stage.getStatus(),
                stage.getSlaMinutes(),
                stage.getActivatedAt(),
                stage.getCompletedAt()
        );
    }

    public static ApprovalTaskResponse toTaskResponse(ApprovalTask task) {
        return new ApprovalTaskResponse(
                task.getId(),
                task.getApprovalInstanceId(),
                task.getApprovalStageId(),
                task.getAssigneePrincipalId(),
                task.getAssigneeGroupId(),
                task.getTaskType(),
                task.getStatus(),
                task.getDecidedBy(),
                task.getDecisionNote(),
                task.getDueAt(),
                task.getDecidedAt()
        );
    }

    public static AssignmentSnapshotResponse toSnapshotResponse(ApprovalAssignmentSnapshot snapshot) {
        return new AssignmentSnapshotResponse(
                snapshot.getApprovalInstanceId(),
                snapshot.getApprovalStageId(),
                snapshot.getStageNo(),
                snapshot.getResolvedAssignees(),
                snapshot.getEvaluationContext(),
                snapshot.getCreatedBy(),
                snapshot.getCreatedAt()
        );
    }

    public static ApprovalEventResponse toEventResponse(ApprovalEvent event) {
        return new ApprovalEventResponse(
                event.getId(),
                event.getEventType(),
                event.getApprovalTaskId(),
                event.getActorId(),
                event.getPayload(),
                event.getOccurredAt()
        );
    }

    public static ApprovalDecisionResponse toDecisionResponse(ApprovalDecisionResult result) {
        return new ApprovalDecisionResponse(
                result.success(),
                result.taskId(),
                result.taskStatus(),
                result.stageStatus(),
                result.instanceStatus(),
                result.transitionTriggered(),
                result.error()
        );
    }
}
