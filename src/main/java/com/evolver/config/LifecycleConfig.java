package com.evolver.config;

/**
 * Rule confidence and lifecycle constants.
 *
 * @param initialConfidence    confidence of newly added rules
 * @param reward               added per successful node a rule built in the cycle
 * @param penalty              subtracted per failed or skipped node a rule built in the cycle
 * @param decayRate            unused rules lose this fraction of their confidence per cycle
 * @param cooldownThreshold    ACTIVE rules below it move to COOLDOWN
 * @param deprecateAfterCycles consecutive below-threshold cycles before COOLDOWN becomes DEPRECATED
 */
public record LifecycleConfig(
        double initialConfidence,
        double reward,
        double penalty,
        double decayRate,
        double cooldownThreshold,
        int deprecateAfterCycles
) {
    public LifecycleConfig {
        requireUnit("initialConfidence", initialConfidence);
        requireUnit("reward", reward);
        requireUnit("penalty", penalty);
        requireUnit("decayRate", decayRate);
        requireUnit("cooldownThreshold", cooldownThreshold);
        if (deprecateAfterCycles < 1) {
            throw new IllegalArgumentException("deprecateAfterCycles must be at least 1");
        }
    }

    public static LifecycleConfig defaults() {
        return new LifecycleConfig(0.5, 0.05, 0.1, 0.1, 0.3, 3);
    }

    private static void requireUnit(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within [0, 1], got " + value);
        }
    }
}
