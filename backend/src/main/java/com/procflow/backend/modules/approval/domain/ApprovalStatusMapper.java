package com.procflow.backend.modules.approval.domain;

import java.util.Map;

/**
 * Maps stored instance state to the status callers see.
 *
 * <p>The stored {@code outcome} wins when present. Rows written without an outcome fall back to the
 * status, where a {@code CANCELED} row whose context reason is {@code "rejected"} reads as {@code REJECTED}.</p>
 */
public final class ApprovalStatusMapper {

    private ApprovalStatusMapper() {
    }

    public static ApprovalStatus toExternalStatus(ApprovalInstance instance) {
        return toExternalStatus(instance.getStatus(), instance.getOutcome(), instance.getContext());
    }

    public static ApprovalStatus toExternalStatus(ApprovalInstanceStatus status, ApprovalStatus outcome,
                                                  Map<String, Object> context) {
        if (outcome != null) {
            return outcome;
        }
        return switch (status) {
            case OPEN -> ApprovalStatus.OPEN;
            case COMPLETED -> ApprovalStatus.COMPLETED;
            case CANCELED -> isRejectedReason(context) ? ApprovalStatus.REJECTED : ApprovalStatus.CANCELED;
        };
    }

    private static boolean isRejectedReason(Map<String, Object> context) {
        return context != null && ApprovalInstance.REASON_REJECTED.equals(context.get(ApprovalInstance.CONTEXT_REASON));
    }
}
