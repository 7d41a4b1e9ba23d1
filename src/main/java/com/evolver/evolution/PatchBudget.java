package com.evolver.evolution;

/**
 * Limits on how fast the model may change.
 *
 * @param windowMillis          length of the rolling window
 * @param maxPatchesPerWindow   committed patches allowed per window
 * @param maxRuleCountIncrease  net rule growth allowed per window
 */
public record PatchBudget(long windowMillis, int maxPatchesPerWindow, int maxRuleCountIncrease) {

    public PatchBudget {
        if (windowMillis <= 0) {
            throw new IllegalArgumentException("Budget window must be positive");
        }
        if (maxPatchesPerWindow < 0 || maxRuleCountIncrease < 0) {
            throw new IllegalArgumentException("Budget limits cannot be negative");
        }
    }

    public static PatchBudget defaults() {
        return new PatchBudget(3_600_000, 5, 10);
    }
}
