package com.procflow.backend.modules.approval.domain;

/**
 * Externally visible status of an approval instance. Also stored as the instance outcome once it closes.
 */
public enum ApprovalStatus {
    OPEN,
    COMPLETED,
    REJECTED,
    CANCELED
}
