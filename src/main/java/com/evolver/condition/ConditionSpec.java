package com.evolver.condition;

import java.util.List;

/**
 * Declarative form of a condition, as stored on rules, carried by patch edits and
 * exported with the world model.
 *
 * @param type       Condition type (EQUALS, GREATER_THAN, AND, etc.)
 * @param field      World-state key the condition reads (e.g., "loggedIn")
 * @param value      Expected value for comparison conditions
 * @param values     List of values for IN/NOT_IN conditions
 * @param conditions Nested conditions for AND/OR/NOT logical conditions
 */
public record ConditionSpec(
        ConditionType type,
        String field,
        Object value,
        List<Object> values,
        List<ConditionSpec> conditions
) {
    public ConditionSpec {
        values = values == null ? null : List.copyOf(values);
        conditions = conditions == null ? null : List.copyOf(conditions);
    }

    public static ConditionSpec alwaysTrue() {
        return new ConditionSpec(ConditionType.ALWAYS_TRUE, null, null, null, null);
    }

    public static ConditionSpec equals(String field, Object value) {
        return new ConditionSpec(ConditionType.EQUALS, field, value, null, null);
    }

    public static ConditionSpec notEquals(String field, Object value) {
        return new ConditionSpec(ConditionType.NOT_EQUALS, field, value, null, null);
    }

    public static ConditionSpec greaterThan(String field, Number value) {
        return new ConditionSpec(ConditionType.GREATER_THAN, field, value, null, null);
    }

    public static ConditionSpec exists(String field) {
        return new ConditionSpec(ConditionType.EXISTS, field, null, null, null);
    }

    public static ConditionSpec in(String field, List<Object> values) {
        return new ConditionSpec(ConditionType.IN, field, null, values, null);
    }

    public static ConditionSpec and(List<ConditionSpec> conditions) {
        return new ConditionSpec(ConditionType.AND, null, null, null, conditions);
    }

    public static ConditionSpec or(List<ConditionSpec> conditions) {
        return new ConditionSpec(ConditionType.OR, null, null, null, conditions);
    }

    public static ConditionSpec not(ConditionSpec condition) {
        return new ConditionSpec(ConditionType.NOT, null, null, null, List.of(condition));
    }

    @Override
    public String toString() {
        return switch (type) {
            case ALWAYS_TRUE -> "ALWAYS_TRUE";
            case EQUALS -> field + " == " + value;
            case NOT_EQUALS -> field + " != " + value;
            case GREATER_THAN -> field + " > " + value;
            case GREATER_THAN_OR_EQUALS -> field + " >= " + value;
            case LESS_THAN -> field + " < " + value;
            case LESS_THAN_OR_EQUALS -> field + " <= " + value;
            case IN -> field + " IN " + values;
            case NOT_IN -> field + " NOT IN " + values;
            case EXISTS -> field + " EXISTS";
            case AND -> "AND" + conditions;
            case OR -> "OR" + conditions;
            case NOT -> "NOT" + conditions;
        };
    }
}
