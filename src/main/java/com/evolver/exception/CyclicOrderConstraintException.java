package com.evolver.exception;

import java.util.List;

/**
 * Thrown when order constraints (or the graph they produce) contain a cycle.
 */
public class CyclicOrderConstraintException extends EvolverException {

    private final List<String> cycle;

    public CyclicOrderConstraintException(List<String> cycle) {
        super("Order constraints form a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /**
     * Actions (or node ids) along the detected cycle, first element repeated at the end.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
