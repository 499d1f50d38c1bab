package com.procflow.backend.modules.condition.domain;

public enum LogicalOperator {
    AND,
    OR;

    public static LogicalOperator fromCode(Object code) {
        if (code instanceof String text && "or".equalsIgnoreCase(text.trim())) {
            return OR;
        }
        return AND;
    }
}
