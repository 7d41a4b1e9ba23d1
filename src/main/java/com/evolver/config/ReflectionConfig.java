package com.evolver.config;

/**
 * Reflection tuning.
 *
 * @param maxConditionsPerRule a blamed rule already carrying this many conditions is deprecated
 *                             instead of specialized further
 * @param maxEditsPerProposal  advisor proposals with more edits are rejected
 */
public record ReflectionConfig(int maxConditionsPerRule, int maxEditsPerProposal) {

    public ReflectionConfig {
        if (maxConditionsPerRule < 1) {
            throw new IllegalArgumentException("maxConditionsPerRule must be at least 1");
        }
        if (maxEditsPerProposal < 1) {
            throw new IllegalArgumentException("maxEditsPerProposal must be at least 1");
        }
    }

    public static ReflectionConfig defaults() {
        return new ReflectionConfig(3, 5);
    }
}
