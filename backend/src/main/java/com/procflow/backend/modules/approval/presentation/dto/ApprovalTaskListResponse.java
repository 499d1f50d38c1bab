package com.procflow.backend.modules.approval.presentation.dto;

import java.util.List;

public record ApprovalTaskListResponse(
        List<ApprovalTaskResponse> items,
        int page,
        int size,
        long totalElements
) {
}
