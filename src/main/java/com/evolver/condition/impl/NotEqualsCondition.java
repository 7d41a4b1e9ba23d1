package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

/**
 * Condition that checks a state key does not hold a value.
 * A missing key counts as "not equal".
 */
public class NotEqualsCondition implements Condition {

    private final String field;
    private final Object rejectedValue;

    public NotEqualsCondition(String field, Object rejectedValue) {
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    @Override
    public boolean evaluate(WorldState state) {
        return !state.satisfies(field, rejectedValue);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT_EQUALS;
    }

    @Override
    public String toString() {
        return field + " != " + rejectedValue;
    }
}
