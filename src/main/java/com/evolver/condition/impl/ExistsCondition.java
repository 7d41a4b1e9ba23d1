package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

/**
 * Condition that checks if a state key is present.
 */
public class ExistsCondition implements Condition {

    private final String field;

    public ExistsCondition(String field) {
        this.field = field;
    }

    @Override
    public boolean evaluate(WorldState state) {
        return state.contains(field);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EXISTS;
    }

    @Override
    public String toString() {
        return field + " EXISTS";
    }
}
