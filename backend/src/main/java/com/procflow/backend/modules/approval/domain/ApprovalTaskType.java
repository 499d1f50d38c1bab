package com.procflow.backend.modules.approval.domain;

public enum ApprovalTaskType {
    APPROVER,
    OBSERVER
}
