package com.procflow.backend.modules.lifecycle.application;

import java.util.UUID;

public record TransitionResult(
        boolean success,
        String fromStateCode,
        String toStateCode,
        UUID eventId,
        String reason
) {

    public static TransitionResult applied(String fromStateCode, String toStateCode, UUID eventId) {
        return new TransitionResult(true, fromStateCode, toStateCode, eventId, null);
    }

    public static TransitionResult rejected(String reason) {
        return new TransitionResult(false, null, null, null, reason);
    }
}
