package com.evolver.engine;

/**
 * Overall outcome of a run.
 */
public enum ExecutionStatus {
    /** Every node succeeded. */
    SUCCESS,
    /** Some nodes succeeded, others failed or were skipped. */
    PARTIAL,
    /** No node succeeded. */
    FAILURE
}
