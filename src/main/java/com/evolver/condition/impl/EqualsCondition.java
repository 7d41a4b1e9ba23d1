package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

/**
 * Condition that checks if a state key holds a specific value.
 */
public class EqualsCondition implements Condition {

    private final String field;
    private final Object expectedValue;

    public EqualsCondition(String field, Object expectedValue) {
        this.field = field;
        this.expectedValue = expectedValue;
    }

    @Override
    public boolean evaluate(WorldState state) {
        // Missing key = condition is false
        return state.satisfies(field, expectedValue);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EQUALS;
    }

    @Override
    public String toString() {
        return field + " == " + expectedValue;
    }
}
