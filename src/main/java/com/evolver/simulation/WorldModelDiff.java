package com.evolver.simulation;

/**
 * Patched minus baseline, per metric.
 */
public record WorldModelDiff(
        double successDelta,
        double meanExecutionDelta,
        int ruleCountDelta,
        double specializationDelta,
        double stabilityDelta
) {
    private static final double EPSILON = 1e-9;

    public static WorldModelDiff between(SimulationMetrics baseline, SimulationMetrics patched) {
        return new WorldModelDiff(
                patched.successRate() - baseline.successRate(),
                patched.meanExecutionMillis() - baseline.meanExecutionMillis(),
                patched.ruleCount() - baseline.ruleCount(),
                patched.specializationScore() - baseline.specializationScore(),
                patched.stability() - baseline.stability());
    }

    public boolean successRegresses() {
        return successDelta < -EPSILON;
    }

    /**
     * Whether at least one metric strictly improves: more successes, more stable runs,
     * faster runs, fewer rules or more general rules.
     */
    public boolean improvesAnything() {
        return successDelta > EPSILON
                || stabilityDelta > EPSILON
                || meanExecutionDelta < -EPSILON
                || ruleCountDelta < 0
                || specializationDelta < -EPSILON;
    }
}
