package com.evolver.simulation;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed, ordered set of tasks both sides of a simulation run.
 */
public record TaskSet(List<SimulationTask> tasks) {

    public TaskSet {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        Set<String> ids = new HashSet<>();
        for (SimulationTask task : tasks) {
            if (!ids.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id: " + task.id());
            }
        }
    }

    public static TaskSet of(SimulationTask... tasks) {
        return new TaskSet(List.of(tasks));
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }
}
