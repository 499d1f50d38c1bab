package com.procflow.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record AssignmentSnapshotResponse(
        UUID approvalInstanceId,
        UUID approvalStageId,
        int stageNo,
        List<Map<String, Object>> resolvedAssignees,
        Map<String, Object> evaluationContext,
        String createdBy,
        OffsetDateTime createdAt
) {
}
