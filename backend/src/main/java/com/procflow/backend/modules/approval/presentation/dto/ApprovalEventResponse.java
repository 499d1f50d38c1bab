package com.procflow.backend.modules.approval.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record ApprovalEventResponse(
        UUID id,
        String eventType,
        UUID approvalTaskId,
        String actorId,
        Map<String, Object> payload,
        OffsetDateTime occurredAt
) {
}
