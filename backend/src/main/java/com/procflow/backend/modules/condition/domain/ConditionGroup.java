package com.procflow.backend.modules.condition.domain;

import java.util.List;
import java.util.Objects;

public record ConditionGroup(LogicalOperator operator, List<ConditionNode> conditions) implements ConditionNode {

    public ConditionGroup {
        operator = Objects.requireNonNullElse(operator, LogicalOperator.AND);
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }

    public static ConditionGroup and(List<ConditionNode> conditions) {
        return new ConditionGroup(LogicalOperator.AND, conditions);
    }

    public static ConditionGroup or(List<ConditionNode> conditions) {
        return new ConditionGroup(LogicalOperator.OR, conditions);
    }
}
