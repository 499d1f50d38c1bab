package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.util.UUID;

public record TransitionResponse(
        boolean success,
        String fromStateCode,
        String toStateCode,
        UUID eventId,
        String reason
) {
}
