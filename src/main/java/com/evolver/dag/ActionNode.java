package com.evolver.dag;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A node of an {@link ActionDAG}. Run status lives with the execution, not the node,
 * so the same graph can be executed more than once.
 *
 * @param id           unique node id within the graph
 * @param action       wrapped action
 * @param predecessors ids of nodes that must succeed first
 */
public record ActionNode(String id, Action action, Set<String> predecessors) {

    public ActionNode {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Node id cannot be blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("Node '" + id + "' has no action");
        }
        predecessors = predecessors == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(predecessors));
    }

    public String actionName() {
        return action.name();
    }
}
