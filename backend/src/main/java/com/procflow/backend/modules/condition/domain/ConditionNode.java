package com.procflow.backend.modules.condition.domain;

/**
 * Node of a boolean condition tree matched against a read-only evaluation context.
 */
public interface ConditionNode {
}
