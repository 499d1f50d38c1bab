package com.procflow.backend.modules.approval.domain;

public enum SlaTimerStatus {
    SCHEDULED,
    FIRED,
    CANCELED
}
