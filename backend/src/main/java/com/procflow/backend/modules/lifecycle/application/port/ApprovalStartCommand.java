package com.procflow.backend.modules.lifecycle.application.port;

import java.util.Map;
import java.util.UUID;

public record ApprovalStartCommand(
        String entityName,
        String entityId,
        UUID transitionId,
        UUID approvalTemplateId,
        Map<String, Object> record
) {
}
