package com.procflow.backend.modules.condition.domain;

import java.util.Objects;

/**
 * Leaf comparison. The operator is kept as its raw code so that an unknown code simply fails to match.
 */
public record FieldCondition(String field, String operator, Object value) implements ConditionNode {

    public FieldCondition {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(operator, "operator is required");
    }

    public static FieldCondition of(String field, ConditionOperator operator, Object value) {
        return new FieldCondition(field, operator.getCode(), value);
    }
}
