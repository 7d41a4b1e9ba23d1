package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

import java.util.List;
import java.util.Optional;

/**
 * Condition that checks if a state value is in a list of allowed values.
 */
public class InCondition implements Condition {

    private final String field;
    private final List<Object> allowedValues;

    public InCondition(String field, List<Object> allowedValues) {
        this.field = field;
        this.allowedValues = allowedValues;
    }

    @Override
    public boolean evaluate(WorldState state) {
        Optional<Object> actual = state.get(field);
        if (actual.isEmpty()) {
            return false;
        }
        for (Object allowed : allowedValues) {
            if (WorldState.sameValue(actual.get(), allowed)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.IN;
    }

    @Override
    public String toString() {
        return field + " IN " + allowedValues;
    }
}
