package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

import java.util.List;

/**
 * Logical AND condition - all nested conditions must be true.
 */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(WorldState state) {
        return conditions.stream().allMatch(c -> c.evaluate(state));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return "AND(" + conditions + ")";
    }
}
