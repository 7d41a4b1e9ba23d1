package com.evolver.dag;

import java.util.List;

/**
 * Turns a goal into its seed action sequence. One implementation per goal kind.
 */
@FunctionalInterface
public interface GoalDecomposer {

    /**
     * @param goal goal to decompose
     * @return seed actions in execution order; never empty
     */
    List<Action> decompose(Goal goal);
}
