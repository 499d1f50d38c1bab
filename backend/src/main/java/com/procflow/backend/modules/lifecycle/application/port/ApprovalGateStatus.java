package com.procflow.backend.modules.lifecycle.application.port;

/**
 * Externally visible status of the approval workflow attached to an entity.
 */
public enum ApprovalGateStatus {
    OPEN,
    COMPLETED,
    REJECTED,
    CANCELED
}
