package com.procflow.backend.modules.approval.domain;

public enum ApprovalInstanceStatus {
    OPEN,
    COMPLETED,
    CANCELED
}
