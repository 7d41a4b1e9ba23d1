package com.evolver.capability;

/**
 * Failure signatures a capability can report. Reflection picks its patch edit by signature.
 */
public enum FailureKind {
    /** Required world state was absent when the action ran. */
    MISSING_PRECONDITION,
    /** The action ran before an action it depends on. */
    ORDERING_VIOLATION,
    TIMEOUT,
    ERROR
}
