package com.procflow.backend.modules.lifecycle.application.port;

import java.util.Optional;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;

/**
 * What the gate evaluator needs from the approval engine. Implemented by the approval module.
 */
public interface ApprovalGatePort {

    /**
     * Status of the open approval instance for the entity, if one exists.
     */
    Optional<ApprovalGateStatus> findOpenApprovalStatus(UUID tenantId, String entityName, String entityId);

    ApprovalStartResult startApproval(ApprovalStartCommand command, RequestContext ctx);
}
