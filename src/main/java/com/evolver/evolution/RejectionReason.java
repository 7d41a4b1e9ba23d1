package com.evolver.evolution;

public enum RejectionReason {
    /** Accepting it would exceed the patch or rule-growth budget. */
    BUDGET_EXCEEDED,
    /** Success regresses, or no metric improves. */
    NO_IMPROVEMENT,
    /** Another candidate is at least as good on every objective and better on one. */
    DOMINATED
}
