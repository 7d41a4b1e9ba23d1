package com.evolver.simulation;

import com.evolver.state.WorldState;

import java.util.Map;

/**
 * One entry of the fixed evaluation task set.
 */
public record SimulationTask(String id, String goal, Map<String, Object> initialState) {

    public SimulationTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be blank");
        }
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Task '" + id + "' has no goal");
        }
        initialState = initialState == null ? Map.of() : Map.copyOf(initialState);
    }

    public static SimulationTask of(String id, String goal) {
        return new SimulationTask(id, goal, Map.of());
    }

    public WorldState state() {
        return WorldState.of(initialState);
    }
}
