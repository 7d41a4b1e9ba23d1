package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

import java.util.Optional;

/**
 * Numeric comparison conditions (>, >=, <, <=).
 */
public class ComparisonCondition implements Condition {

    private final String field;
    private final Number threshold;
    private final ConditionType type;

    public ComparisonCondition(String field, Number threshold, ConditionType type) {
        this.field = field;
        this.threshold = threshold;
        this.type = type;
    }

    @Override
    public boolean evaluate(WorldState state) {
        Optional<Double> actual = state.get(field).flatMap(ComparisonCondition::toDouble);
        if (actual.isEmpty()) {
            return false;
        }

        double actualValue = actual.get();
        double thresholdValue = threshold.doubleValue();

        return switch (type) {
            case GREATER_THAN -> actualValue > thresholdValue;
            case GREATER_THAN_OR_EQUALS -> actualValue >= thresholdValue;
            case LESS_THAN -> actualValue < thresholdValue;
            case LESS_THAN_OR_EQUALS -> actualValue <= thresholdValue;
            default -> throw new IllegalStateException("Invalid comparison type: " + type);
        };
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        try {
            return Optional.of(Double.parseDouble(value.toString()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    @Override
    public String toString() {
        String op = switch (type) {
            case GREATER_THAN -> ">";
            case GREATER_THAN_OR_EQUALS -> ">=";
            case LESS_THAN -> "<";
            case LESS_THAN_OR_EQUALS -> "<=";
            default -> "?";
        };
        return field + " " + op + " " + threshold;
    }
}
