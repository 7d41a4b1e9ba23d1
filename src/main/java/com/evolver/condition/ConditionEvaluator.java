package com.evolver.condition;

import com.evolver.state.WorldState;

import java.util.List;

/**
 * Factory and evaluator for conditions.
 */
public interface ConditionEvaluator {

    /**
     * Create a Condition instance from its declarative form.
     *
     * @param spec Condition specification
     * @return Condition instance
     */
    Condition create(ConditionSpec spec);

    /**
     * Evaluate a condition specification directly against a state.
     */
    default boolean evaluate(ConditionSpec spec, WorldState state) {
        return create(spec).evaluate(state);
    }

    /**
     * True when every specification holds; an empty list always holds.
     */
    default boolean evaluateAll(List<ConditionSpec> specs, WorldState state) {
        for (ConditionSpec spec : specs) {
            if (!evaluate(spec, state)) {
                return false;
            }
        }
        return true;
    }
}
