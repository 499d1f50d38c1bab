package com.procflow.backend.modules.condition.domain;

import java.util.Arrays;
import java.util.Optional;

public enum ConditionOperator {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),
    IN("in"),
    NOT_IN("not_in"),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    STARTS_WITH("starts_with"),
    ENDS_WITH("ends_with"),
    MATCHES("matches"),
    EXISTS("exists"),
    NOT_EXISTS("not_exists"),
    BETWEEN("between"),
    EMPTY("empty"),
    NOT_EMPTY("not_empty"),
    DATE_BEFORE("date_before"),
    DATE_AFTER("date_after");

    private final String code;

    ConditionOperator(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<ConditionOperator> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(operator -> operator.code.equals(normalized))
                .findFirst();
    }
}
