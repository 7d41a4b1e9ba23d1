package com.evolver.rule;

/**
 * Lifecycle status of a rule. Transitions only move forward:
 * ACTIVE -> COOLDOWN -> DEPRECATED.
 */
public enum RuleStatus {
    ACTIVE,
    COOLDOWN,
    DEPRECATED;

    /**
     * Check whether moving from this status to {@code next} keeps the lifecycle one-directional.
     */
    public boolean canTransitionTo(RuleStatus next) {
        return next.ordinal() >= this.ordinal();
    }
}
