package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record LifecycleEventResponse(
        UUID id,
        String eventType,
        UUID transitionId,
        String operationCode,
        String fromStateCode,
        String toStateCode,
        String actorId,
        Map<String, Object> payload,
        OffsetDateTime occurredAt
) {
}
