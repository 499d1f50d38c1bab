package com.procflow.backend.modules.condition.application;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntPredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.procflow.backend.modules.condition.domain.ConditionGroup;
import com.procflow.backend.modules.condition.domain.ConditionNode;
import com.procflow.backend.modules.condition.domain.ConditionOperator;
import com.procflow.backend.modules.condition.domain.FieldCondition;
import com.procflow.backend.modules.condition.domain.LogicalOperator;

/**
 * Pure recursive interpreter for {@link ConditionNode} trees.
 * Every comparison that cannot be performed (type mismatch, bad regex, unknown operator) evaluates to {@code false}.
 */
public final class ConditionEvaluator {

    private ConditionEvaluator() {
    }

    public static boolean matches(Object rawConditions, Map<String, Object> context) {
        if (ConditionParser.isBlank(rawConditions)) {
            return true;
        }
        return evaluate(ConditionParser.parse(rawConditions), context);
    }

    public static boolean evaluate(ConditionNode node, Map<String, Object> context) {
        if (node == null) {
            return true;
        }
        if (node instanceof ConditionGroup group) {
            return evaluateGroup(group, context);
        }
        if (node instanceof FieldCondition condition) {
            return evaluateCondition(condition, context);
        }
        return false;
    }

    public static boolean evaluateGroup(ConditionGroup group, Map<String, Object> context) {
        if (group.operator() == LogicalOperator.OR) {
            return group.conditions().stream().anyMatch(child -> evaluate(child, context));
        }
        return group.conditions().stream().allMatch(child -> evaluate(child, context));
    }

    public static boolean evaluateCondition(FieldCondition condition, Map<String, Object> context) {
        Optional<ConditionOperator> operator = ConditionOperator.fromCode(condition.operator());
        if (operator.isEmpty()) {
            return false;
        }
        Object actual = resolveFieldValue(condition.field(), context);
        Object expected = condition.value();
        return switch (operator.get()) {
            case EQ -> looselyEquals(actual, expected);
            case NE -> !looselyEquals(actual, expected);
            case GT -> compareNumbers(actual, expected, result -> result > 0);
            case GTE -> compareNumbers(actual, expected, result -> result >= 0);
            case LT -> compareNumbers(actual, expected, result -> result < 0);
            case LTE -> compareNumbers(actual, expected, result -> result <= 0);
            case IN -> expected instanceof Collection<?> options && containsLoosely(options, actual);
            case NOT_IN -> expected instanceof Collection<?> options && !containsLoosely(options, actual);
            case CONTAINS -> contains(actual, expected);
            case NOT_CONTAINS -> !contains(actual, expected);
            case STARTS_WITH -> actual instanceof String text && expected != null
                    && text.startsWith(String.valueOf(expected));
            case ENDS_WITH -> actual instanceof String text && expected != null
                    && text.endsWith(String.valueOf(expected));
            case MATCHES -> regexMatches(actual, expected);
            case EXISTS -> actual != null;
            case NOT_EXISTS -> actual == null;
            case BETWEEN -> between(actual, expected);
            case EMPTY -> isEmpty(actual);
            case NOT_EMPTY -> !isEmpty(actual);
            case DATE_BEFORE -> compareDates(actual, expected, result -> result < 0);
            case DATE_AFTER -> compareDates(actual, expected, result -> result > 0);
        };
    }

    /**
     * Resolves a dotted path ({@code address.city}) against nested maps. Missing segments resolve to {@code null}.
     */
    public static Object resolveFieldValue(String path, Map<String, Object> context) {
        if (path == null || context == null) {
            return null;
        }
        Object current = context;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static boolean looselyEquals(Object actual, Object expected) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        if (left != null && right != null) {
            return left.compareTo(right) == 0;
        }
        return Objects.equals(actual, expected);
    }

    private static boolean containsLoosely(Collection<?> options, Object actual) {
        return options.stream().anyMatch(option -> looselyEquals(actual, option));
    }

    private static boolean compareNumbers(Object actual, Object expected, IntPredicate accept) {
        BigDecimal left = toNumber(actual);
        BigDecimal right = toNumber(expected);
        return left != null && right != null && accept.test(left.compareTo(right));
    }

    private static boolean contains(Object actual, Object expected) {
        if (actual instanceof String text) {
            return expected != null && text.contains(String.valueOf(expected));
        }
        if (actual instanceof Collection<?> items) {
            return containsLoosely(items, expected);
        }
        return false;
    }

    private static boolean regexMatches(Object actual, Object expected) {
        if (actual == null || !(expected instanceof String regex)) {
            return false;
        }
        try {
            return Pattern.compile(regex).matcher(String.valueOf(actual)).find();
        } catch (PatternSyntaxException ex) {
            return false;
        }
    }

    private static boolean between(Object actual, Object expected) {
        if (!(expected instanceof List<?> bounds) || bounds.size() != 2) {
            return false;
        }
        BigDecimal value = toNumber(actual);
        BigDecimal lower = toNumber(bounds.get(0));
        BigDecimal upper = toNumber(bounds.get(1));
        if (value == null || lower == null || upper == null) {
            return false;
        }
        return value.compareTo(lower) >= 0 && value.compareTo(upper) <= 0;
    }

    private static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String text) {
            return text.isEmpty();
        }
        if (value instanceof Collection<?> items) {
            return items.isEmpty();
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        return false;
    }

    private static boolean compareDates(Object actual, Object expected, IntPredicate accept) {
        Instant left = toInstant(actual);
        Instant right = toInstant(expected);
        return left != null && right != null && accept.test(left.compareTo(right));
    }

    static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    static Instant toInstant(Object value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        if (value instanceof String text && !text.isBlank()) {
            return parseInstant(text.trim());
        }
        return null;
    }

    private static Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignored) {
            // try the next format
        }
        try {
            return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }
}
