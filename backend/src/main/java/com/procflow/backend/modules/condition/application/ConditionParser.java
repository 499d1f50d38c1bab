package com.procflow.backend.modules.condition.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.procflow.backend.modules.condition.domain.ConditionGroup;
import com.procflow.backend.modules.condition.domain.ConditionNode;
import com.procflow.backend.modules.condition.domain.FieldCondition;
import com.procflow.backend.modules.condition.domain.LogicalOperator;

/**
 * Converts the stored jsonb shape into a {@link ConditionNode} tree.
 *
 * <pre>
 * {"operator": "and", "conditions": [{"field": "amount", "operator": "gt", "value": 100}, ...]}
 * </pre>
 *
 * A bare list is read as an {@code and} group. {@code null} yields {@code null}, meaning "no conditions".
 */
public final class ConditionParser {

    private ConditionParser() {
    }

    public static ConditionNode parse(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Collection<?> items) {
            return ConditionGroup.and(parseChildren(items));
        }
        if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("field")) {
                return parseField(map);
            }
            Object children = map.get("conditions");
            List<ConditionNode> nodes = children instanceof Collection<?> items ? parseChildren(items) : List.of();
            return new ConditionGroup(LogicalOperator.fromCode(map.get("operator")), nodes);
        }
        throw new IllegalArgumentException("Unsupported condition node: " + raw.getClass().getSimpleName());
    }

    /**
     * True when the raw definition carries no condition at all, in which case it matches unconditionally.
     */
    public static boolean isBlank(Object raw) {
        if (raw == null) {
            return true;
        }
        if (raw instanceof Collection<?> items) {
            return items.isEmpty();
        }
        if (raw instanceof Map<?, ?> map) {
            if (map.containsKey("field")) {
                return false;
            }
            Object children = map.get("conditions");
            return !(children instanceof Collection<?> items) || items.isEmpty();
        }
        return false;
    }

    private static List<ConditionNode> parseChildren(Collection<?> items) {
        List<ConditionNode> nodes = new ArrayList<>(items.size());
        for (Object item : items) {
            ConditionNode node = parse(item);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static FieldCondition parseField(Map<?, ?> map) {
        Object field = map.get("field");
        Object operator = map.get("operator");
        if (!(field instanceof String fieldName) || fieldName.isBlank()) {
            throw new IllegalArgumentException("Condition field must be a non-blank string");
        }
        String operatorCode = operator instanceof String text ? text : "eq";
        return new FieldCondition(fieldName, operatorCode, map.get("value"));
    }
}
