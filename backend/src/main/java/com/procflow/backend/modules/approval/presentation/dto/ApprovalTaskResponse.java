package com.procflow.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalTaskStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTaskType;

public record ApprovalTaskResponse(
        UUID id,
        UUID approvalInstanceId,
        UUID approvalStageId,
        String assigneePrincipalId,
        String assigneeGroupId,
        ApprovalTaskType taskType,
        ApprovalTaskStatus status,
        String decidedBy,
        String decisionNote,
        OffsetDateTime dueAt,
        OffsetDateTime decidedAt
) {
}
