package com.procflow.backend.modules.lifecycle.application;

/**
 * Outcome of gate evaluation. {@code reason} doubles as a control signal for callers, so its wording is stable.
 */
public record GateDecision(boolean allowed, String reason) {

    public static final String APPROVAL_INITIATED = "Approval workflow initiated";
    public static final String APPROVAL_PENDING = "Approval pending";
    public static final String APPROVAL_CANCELED = "Approval was canceled";
    public static final String APPROVAL_REQUIRED = "Approval required";
    public static final String MISSING_OPERATION_PREFIX = "Missing required operation: ";
    public static final String APPROVAL_CREATE_FAILED_PREFIX = "Failed to create approval: ";

    public static GateDecision allow() {
        return new GateDecision(true, null);
    }

    public static GateDecision block(String reason) {
        return new GateDecision(false, reason);
    }
}
