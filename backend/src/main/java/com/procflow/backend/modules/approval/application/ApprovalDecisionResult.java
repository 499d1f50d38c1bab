package com.procflow.backend.modules.approval.application;

import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalStatus;
import com.procflow.backend.modules.approval.domain.ApprovalTaskStatus;
import com.procflow.backend.modules.approval.domain.StageOutcome;

/**
 * Outcome of one decision. {@code stageStatus} and {@code instanceStatus} are only set when the decision
 * changed them; {@code transitionTriggered} is true when the blocked lifecycle transition was applied.
 */
public record ApprovalDecisionResult(
        boolean success,
        UUID taskId,
        ApprovalTaskStatus taskStatus,
        StageOutcome stageStatus,
        ApprovalStatus instanceStatus,
        boolean transitionTriggered,
        String error
) {

    public static ApprovalDecisionResult recorded(UUID taskId, ApprovalTaskStatus taskStatus) {
        return new ApprovalDecisionResult(true, taskId, taskStatus, null, null, false, null);
    }

    public static ApprovalDecisionResult stageClosed(UUID taskId, ApprovalTaskStatus taskStatus,
                                                     StageOutcome stageStatus, ApprovalStatus instanceStatus,
                                                     boolean transitionTriggered) {
        return new ApprovalDecisionResult(true, taskId, taskStatus, stageStatus, instanceStatus,
                transitionTriggered, null);
    }

    public static ApprovalDecisionResult failed(UUID taskId, String error) {
        return new ApprovalDecisionResult(false, taskId, null, null, null, false, error);
    }
}
