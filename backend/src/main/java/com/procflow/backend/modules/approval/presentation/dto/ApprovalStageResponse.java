package com.procflow.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalStageMode;
import com.procflow.backend.modules.approval.domain.ApprovalStageStatus;

public record ApprovalStageResponse(
        UUID id,
        int stageNo,
        String name,
        ApprovalStageMode mode,
        ApprovalStageStatus status,
        Integer slaMinutes,
        OffsetDateTime activatedAt,
        OffsetDateTime completedAt
) {
}
