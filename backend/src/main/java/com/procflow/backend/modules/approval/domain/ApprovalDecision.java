package com.procflow.backend.modules.approval.domain;

public enum ApprovalDecision {
    APPROVE,
    REJECT
}
