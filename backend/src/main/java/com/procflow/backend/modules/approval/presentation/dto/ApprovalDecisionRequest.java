package com.procflow.backend.modules.approval.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import com.procflow.backend.modules.approval.domain.ApprovalDecision;

public record ApprovalDecisionRequest(
        @NotNull ApprovalDecision decision,
        @Size(max = 2000) String note
) {
}
