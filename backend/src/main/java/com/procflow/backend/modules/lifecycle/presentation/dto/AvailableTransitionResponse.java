package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.util.UUID;

public record AvailableTransitionResponse(
        UUID transitionId,
        String operationCode,
        String name,
        String toStateCode,
        String toStateName,
        boolean requiresApproval,
        UUID approvalTemplateId
) {
}
