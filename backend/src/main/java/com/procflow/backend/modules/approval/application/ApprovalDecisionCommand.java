package com.procflow.backend.modules.approval.application;

import java.util.UUID;

import com.procflow.backend.modules.approval.domain.ApprovalDecision;

public record ApprovalDecisionCommand(UUID taskId, ApprovalDecision decision, String note) {
}
