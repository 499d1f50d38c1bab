package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record LifecycleStateResponse(
        UUID instanceId,
        String entityName,
        String entityId,
        String lifecycleCode,
        UUID stateId,
        String stateCode,
        String stateName,
        boolean terminal,
        String updatedBy,
        OffsetDateTime updatedAt
) {
}
