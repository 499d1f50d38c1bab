package com.procflow.backend.modules.approval.domain;

public enum ApprovalTaskStatus {
    PENDING,
    APPROVED,
    REJECTED
}
