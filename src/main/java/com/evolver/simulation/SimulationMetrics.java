package com.evolver.simulation;

/**
 * Aggregate metrics of running a task set against one rule set.
 *
 * @param successRate         fraction of tasks whose run ended in SUCCESS
 * @param meanExecutionMillis capability-reported duration per task, averaged
 * @param ruleCount           non-deprecated rules
 * @param specializationScore weighted conditions and predecessors of ACTIVE rules
 * @param stability           fraction of executed nodes that succeeded
 */
public record SimulationMetrics(
        double successRate,
        double meanExecutionMillis,
        int ruleCount,
        double specializationScore,
        double stability
) {
}
