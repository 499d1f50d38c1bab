package com.procflow.backend.modules.approval.domain;

public enum SlaTimerKind {
    REMINDER,
    ESCALATION
}
