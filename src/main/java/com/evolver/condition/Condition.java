package com.evolver.condition;

import com.evolver.state.WorldState;

/**
 * A boolean predicate over world-state keys.
 */
public interface Condition {

    /**
     * Evaluate this condition against the given world state.
     *
     * @param state world state snapshot
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(WorldState state);

    /**
     * Get the condition type.
     */
    ConditionType getType();
}
