package com.evolver.condition.impl;

import com.evolver.condition.Condition;
import com.evolver.condition.ConditionType;
import com.evolver.state.WorldState;

/**
 * Condition that always evaluates to true.
 * Used for rules that apply in every state.
 */
public final class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {}

    @Override
    public boolean evaluate(WorldState state) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
