package com.procflow.backend.modules.approval.presentation.dto;

import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTaskStatus;
import com.procflow.backend.modules.approval.domain.StageOutcome;

public record ApprovalDecisionResponse(
        boolean success,
        UUID taskId,
        ApprovalTaskStatus taskStatus,
        StageOutcome stageStatus,
        ApprovalStatus instanceStatus,
        boolean transitionTriggered,
        String error
) {
}
