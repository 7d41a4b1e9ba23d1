package com.evolver.dag;

import com.evolver.state.WorldState;

/**
 * Output of {@link DagBuilder#build}.
 *
 * @param goal          goal that was compiled
 * @param dag           executable graph
 * @param trace         rule evidence per node
 * @param planningState state the rules were evaluated against (includes goal keys)
 */
public record BuildResult(Goal goal, ActionDAG dag, BuildTrace trace, WorldState planningState) {
}
