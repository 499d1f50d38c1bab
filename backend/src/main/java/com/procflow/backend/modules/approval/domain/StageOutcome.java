package com.procflow.backend.modules.approval.domain;

/**
 * Status a closed stage reports to callers.
 */
public enum StageOutcome {
    COMPLETED,
    REJECTED
}
