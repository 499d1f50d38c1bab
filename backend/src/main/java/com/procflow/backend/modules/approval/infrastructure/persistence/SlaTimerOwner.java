package com.procflow.backend.modules.approval.infrastructure.persistence;

import java.util.UUID;

/**
 * Instance and tenant a timer belongs to, read without loading the timer itself.
 */
public record SlaTimerOwner(UUID approvalInstanceId, UUID tenantId) {
}
