package com.evolver.evolution;

/**
 * Budget consumption in the current window.
 */
public record BudgetStatus(
        int patchesUsed,
        int patchesRemaining,
        int ruleGrowthUsed,
        int ruleGrowthRemaining,
        long windowMillis
) {
}
