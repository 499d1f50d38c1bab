package com.procflow.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalStatus;

public record ApprovalInstanceResponse(
        UUID id,
        String entityName,
        String entityId,
        UUID transitionId,
        UUID approvalTemplateId,
        ApprovalStatus status,
        String reason,
        String createdBy,
        OffsetDateTime createdAt,
        OffsetDateTime closedAt,
        List<ApprovalStageResponse> stages
) {
}
