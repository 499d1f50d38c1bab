package com.procflow.backend.modules.lifecycle.application.port;

import java.util.UUID;

public record ApprovalStartResult(boolean success, UUID instanceId, int stageCount, int taskCount, String error) {

    public static ApprovalStartResult started(UUID instanceId, int stageCount, int taskCount) {
        return new ApprovalStartResult(true, instanceId, stageCount, taskCount, null);
    }

    public static ApprovalStartResult failed(String error) {
        return new ApprovalStartResult(false, null, 0, 0, error);
    }
}
