package com.procflow.backend.modules.approval.domain;

public enum QuorumType {
    COUNT,
    PERCENTAGE
}
