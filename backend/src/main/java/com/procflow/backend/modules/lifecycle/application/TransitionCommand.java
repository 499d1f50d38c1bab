package com.procflow.backend.modules.lifecycle.application;

import java.util.Map;
import java.util.Objects;

public record TransitionCommand(String entityName, String entityId, String operationCode, Map<String, Object> record) {

    public TransitionCommand {
        Objects.requireNonNull(entityName, "entityName is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(operationCode, "operationCode is required");
        record = record != null ? record : Map.of();
    }
}
