package com.evolver.rule;

import java.time.Instant;

/**
 * Usage statistics and lifecycle state of a rule.
 *
 * @param successCount         executions where a node built by the rule succeeded
 * @param failureCount         executions where a node built by the rule failed or was skipped
 * @param confidence           confidence in [0, 1]
 * @param status               lifecycle status
 * @param lastUpdated          last time any field changed
 * @param belowThresholdCycles consecutive evolution cycles spent below the cooldown threshold
 */
public record RuleMetadata(
        long successCount,
        long failureCount,
        double confidence,
        RuleStatus status,
        Instant lastUpdated,
        int belowThresholdCycles
) {
    public RuleMetadata {
        if (status == null) {
            throw new IllegalArgumentException("Rule status cannot be null");
        }
        if (Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Confidence cannot be NaN");
        }
        confidence = clamp(confidence);
    }

    public static RuleMetadata initial(double confidence, Instant now) {
        return new RuleMetadata(0, 0, confidence, RuleStatus.ACTIVE, now, 0);
    }

    public RuleMetadata withConfidence(double newConfidence, Instant now) {
        return new RuleMetadata(successCount, failureCount, newConfidence, status, now, belowThresholdCycles);
    }

    public RuleMetadata withStatus(RuleStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal lifecycle transition " + status + " -> " + next);
        }
        return new RuleMetadata(successCount, failureCount, confidence, next, now, belowThresholdCycles);
    }

    public RuleMetadata withBelowThresholdCycles(int cycles, Instant now) {
        return new RuleMetadata(successCount, failureCount, confidence, status, now, cycles);
    }

    public RuleMetadata recordOutcomes(long successes, long failures, Instant now) {
        return new RuleMetadata(successCount + successes, failureCount + failures, confidence, status,
                now, belowThresholdCycles);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
