package com.evolver.evolution;

import com.evolver.simulation.SimulationResult;
import com.evolver.simulation.WorldModelDiff;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pareto selection over (max successDelta, min ruleCountDelta, min specializationDelta).
 */
public final class ParetoFrontier {

    /**
     * Commit order of frontier members: successDelta desc, ruleCountDelta asc, then id.
     */
    public static final Comparator<SimulationResult> ADMISSION_ORDER = Comparator
            .comparingDouble((SimulationResult r) -> r.diff().successDelta()).reversed()
            .thenComparingInt(r -> r.diff().ruleCountDelta())
            .thenComparing(SimulationResult::proposalId);

    private ParetoFrontier() {
    }

    /**
     * Whether {@code a} is at least as good as {@code b} on every objective and strictly
     * better on at least one.
     */
    public static boolean dominates(WorldModelDiff a, WorldModelDiff b) {
        boolean noWorse = a.successDelta() >= b.successDelta()
                && a.ruleCountDelta() <= b.ruleCountDelta()
                && a.specializationDelta() <= b.specializationDelta();
        boolean better = a.successDelta() > b.successDelta()
                || a.ruleCountDelta() < b.ruleCountDelta()
                || a.specializationDelta() < b.specializationDelta();
        return noWorse && better;
    }

    /**
     * Non-dominated candidates, in admission order.
     */
    public static List<SimulationResult> frontier(List<SimulationResult> candidates) {
        List<SimulationResult> frontier = new ArrayList<>();
        for (SimulationResult candidate : candidates) {
            boolean dominated = false;
            for (SimulationResult other : candidates) {
                if (other != candidate && dominates(other.diff(), candidate.diff())) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) {
                frontier.add(candidate);
            }
        }
        frontier.sort(ADMISSION_ORDER);
        return frontier;
    }
}
