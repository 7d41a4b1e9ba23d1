package com.evolver.config;

/**
 * Weights of the specialization score: {@code conditionWeight * conditions + orderWeight * predecessors},
 * summed over ACTIVE rules.
 */
public record SpecializationConfig(double conditionWeight, double orderWeight) {

    public SpecializationConfig {
        if (conditionWeight < 0 || orderWeight < 0) {
            throw new IllegalArgumentException("Specialization weights cannot be negative");
        }
    }

    public static SpecializationConfig defaults() {
        return new SpecializationConfig(1.0, 0.5);
    }
}
