package com.procflow.backend.modules.lifecycle.application;

public record EntityContext(String entityName, String entityId) {
}
