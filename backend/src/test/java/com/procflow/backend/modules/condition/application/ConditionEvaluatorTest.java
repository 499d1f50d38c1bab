package com.procflow.backend.modules.condition.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.procflow.backend.global.common.RequestContext;
import com.procflow.backend.modules.condition.domain.ConditionGroup;
import com.procflow.backend.modules.condition.domain.ConditionOperator;
import com.procflow.backend.modules.condition.domain.FieldCondition;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConditionEvaluatorTest {

    private static Map<String, Object> condition(String field, String operator, Object value) {
        Map<String, Object> condition = new HashMap<>();
        condition.put("field", field);
        condition.put("operator", operator);
        condition.put("value", value);
        return condition;
    }

    @Test
    @DisplayName("absent or empty condition sets always match")
    void blankConditionsMatch() {
        assertThat(ConditionEvaluator.matches(null, Map.of())).isTrue();
        assertThat(ConditionEvaluator.matches(Map.of(), Map.of())).isTrue();
        assertThat(ConditionEvaluator.matches(List.of(), Map.of())).isTrue();
    }

    @Test
    @DisplayName("numeric comparisons coerce numeric strings")
    void numericComparisonsCoerceStrings() {
        Map<String, Object> context = Map.of("amount", "150");

        assertThat(ConditionEvaluator.matches(condition("amount", "gt", 100), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("amount", "lte", "149.99"), context)).isFalse();
        assertThat(ConditionEvaluator.matches(condition("amount", "eq", 150.0), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("amount", "between", List.of(100, 200)), context)).isTrue();
    }

    @Test
    @DisplayName("groups combine children with and/or and default to and")
    void groupsCombineChildren() {
        Map<String, Object> context = Map.of("amount", 5000, "department", "finance");

        Map<String, Object> orGroup = Map.of(
                "operator", "or",
                "conditions", List.of(
                        condition("amount", "gt", 10000),
                        condition("department", "eq", "finance")));
        Map<String, Object> defaultGroup = Map.of(
                "conditions", List.of(
                        condition("amount", "gt", 10000),
                        condition("department", "eq", "finance")));

        assertThat(ConditionEvaluator.matches(orGroup, context)).isTrue();
        assertThat(ConditionEvaluator.matches(defaultGroup, context)).isFalse();
    }

    @Test
    @DisplayName("an empty and-group is true, an empty or-group is false")
    void emptyGroups() {
        assertThat(ConditionEvaluator.evaluate(ConditionGroup.and(List.of()), Map.of())).isTrue();
        assertThat(ConditionEvaluator.evaluate(ConditionGroup.or(List.of()), Map.of())).isFalse();
    }

    @Test
    @DisplayName("dotted paths resolve nested maps")
    void dottedPathsResolveNestedMaps() {
        Map<String, Object> context = Map.of("requester", Map.of("address", Map.of("city", "Berlin")));

        assertThat(ConditionEvaluator.resolveFieldValue("requester.address.city", context)).isEqualTo("Berlin");
        assertThat(ConditionEvaluator.resolveFieldValue("requester.phone.mobile", context)).isNull();
        assertThat(ConditionEvaluator.evaluateCondition(
                FieldCondition.of("requester.address.city", ConditionOperator.STARTS_WITH, "Ber"), context)).isTrue();
    }

    @Test
    @DisplayName("empty treats null, blank string and empty collections as empty")
    void emptyOperator() {
        Map<String, Object> context = new HashMap<>();
        context.put("note", "");
        context.put("tags", List.of());
        context.put("owner", "alice");

        assertThat(ConditionEvaluator.matches(condition("note", "empty", null), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("tags", "empty", null), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("missing", "empty", null), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("owner", "not_empty", null), context)).isTrue();
    }

    @Test
    @DisplayName("in, contains and exists operators")
    void membershipOperators() {
        Map<String, Object> context = Map.of("category", "travel", "roles", List.of("MANAGER", "EMPLOYEE"));

        assertThat(ConditionEvaluator.matches(condition("category", "in", List.of("travel", "training")), context))
                .isTrue();
        assertThat(ConditionEvaluator.matches(condition("category", "not_in", List.of("travel")), context)).isFalse();
        assertThat(ConditionEvaluator.matches(condition("roles", "contains", "MANAGER"), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("category", "exists", null), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("budget", "not_exists", null), context)).isTrue();
    }

    @Test
    @DisplayName("date operators compare ISO strings")
    void dateOperators() {
        Map<String, Object> context = Map.of("startDate", "2025-03-01");

        assertThat(ConditionEvaluator.matches(condition("startDate", "date_before", "2025-03-02T00:00:00Z"), context))
                .isTrue();
        assertThat(ConditionEvaluator.matches(condition("startDate", "date_after", "2025-03-01"), context)).isFalse();
    }

    @Test
    @DisplayName("invalid regex and unknown operators evaluate to false")
    void invalidInputsEvaluateToFalse() {
        Map<String, Object> context = Map.of("code", "TRV-001");

        assertThat(ConditionEvaluator.matches(condition("code", "matches", "^TRV-\\d+$"), context)).isTrue();
        assertThat(ConditionEvaluator.matches(condition("code", "matches", "(unclosed"), context)).isFalse();
        assertThat(ConditionEvaluator.matches(condition("code", "similar_to", "TRV"), context)).isFalse();
    }

    @Test
    @DisplayName("caller fields override record keys in the evaluation context")
    void evaluationContextPrefersCallerFields() {
        Map<String, Object> record = Map.of("userId", "spoofed", "amount", 10);
        Map<String, Object> context = EvaluationContexts.of(record,
                RequestContext.of("alice", UUID.fromString("00000000-0000-0000-0000-000000000001"),
                        List.of("EMPLOYEE")),
                "expense", "42");

        assertThat(context)
                .containsEntry("userId", "alice")
                .containsEntry("requesterId", "alice")
                .containsEntry("amount", 10)
                .containsEntry("entityName", "expense")
                .containsEntry("entityId", "42");
    }
}
