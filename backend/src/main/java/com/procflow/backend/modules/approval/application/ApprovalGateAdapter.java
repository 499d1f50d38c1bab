package com.procflow.backend.modules.approval.application;

import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.approval.domain.ApprovalStatus;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGatePort;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalGateStatus;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartCommand;
import com.procflow.backend.modules.lifecycle.application.port.ApprovalStartResult;

import org.springframework.stereotype.Component;

/**
 * Exposes the approval engine to the lifecycle gate evaluator.
 */
@Component
public class ApprovalGateAdapter implements ApprovalGatePort {

    private final ApprovalInstanceService approvalInstanceService;

    public ApprovalGateAdapter(ApprovalInstanceService approvalInstanceService) {
        this.approvalInstanceService = approvalInstanceService;
    }

    @Override
    public Optional<ApprovalGateStatus> findOpenApprovalStatus(UUID tenantId, String entityName, String entityId) {
        return approvalInstanceService.findOpenStatus(tenantId, entityName, entityId)
                .map(ApprovalGateAdapter::toGateStatus);
    }

    @Override
    public ApprovalStartResult startApproval(ApprovalStartCommand command, RequestContext ctx) {
        ApprovalCreationResult result = approvalInstanceService.createApprovalInstance(new ApprovalCreationCommand(
                command.entityName(),
                command.entityId(),
                command.transitionId(),
                command.approvalTemplateId(),
                command.record()
        ), ctx);
        if (!result.success()) {
            return ApprovalStartResult.failed(result.error());
        }
        return ApprovalStartResult.started(result.instanceId(), result.stageCount(), result.taskCount());
    }

    static ApprovalGateStatus toGateStatus(ApprovalStatus status) {
        return switch (status) {
            case OPEN -> ApprovalGateStatus.OPEN;
            case COMPLETED -> ApprovalGateStatus.COMPLETED;
            case REJECTED -> ApprovalGateStatus.REJECTED;
            case CANCELED -> ApprovalGateStatus.CANCELED;
        };
    }
}
