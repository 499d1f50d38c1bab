package com.procflow.backend.modules.approval.application;

import java.util.UUID;

public record ApprovalCreationResult(boolean success, UUID instanceId, int stageCount, int taskCount, String error) {

    public static ApprovalCreationResult created(UUID instanceId, int stageCount, int taskCount) {
        return new ApprovalCreationResult(true, instanceId, stageCount, taskCount, null);
    }

    public static ApprovalCreationResult failed(String error) {
        return new ApprovalCreationResult(false, null, 0, 0, error);
    }
}
