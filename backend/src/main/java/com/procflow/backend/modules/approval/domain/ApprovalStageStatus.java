package com.procflow.backend.modules.approval.domain;

public enum ApprovalStageStatus {
    PENDING,
    COMPLETED,
    CANCELED
}
