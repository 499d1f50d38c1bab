package com.procflow.backend.modules.approval.application;

import java.util.Map;
import java.util.UUID;

public record ApprovalCreationCommand(
        String entityName,
        String entityId,
        UUID transitionId,
        UUID approvalTemplateId,
        Map<String, Object> record
) {

    public ApprovalCreationCommand {
        record = record != null ? record : Map.of();
    }
}
