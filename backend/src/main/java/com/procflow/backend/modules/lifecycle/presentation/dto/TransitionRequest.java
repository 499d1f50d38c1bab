package com.procflow.backend.modules.lifecycle.presentation.dto;

import java.util.Map;

/**
 * Optional snapshot of the entity record, used by gate conditions, policy checks and approver routing.
 */
public record TransitionRequest(Map<String, Object> record, Boolean dryRun) {

    public boolean isDryRun() {
        return Boolean.TRUE.equals(dryRun);
    }
}
