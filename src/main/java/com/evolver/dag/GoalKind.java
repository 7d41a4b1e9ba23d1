package com.evolver.dag;

import java.util.Locale;

/**
 * Goal categories with their own decomposition.
 */
public enum GoalKind {
    BROWSE,
    SEARCH,
    EXTRACT,
    GENERIC;

    /**
     * Value published under {@code goal.kind} in the planning state.
     */
    public String stateValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
