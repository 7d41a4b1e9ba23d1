package com.evolver.model;

public enum AuditKind {
    /** Root version created at initialization. */
    INIT,
    /** Accepted proposal committed. */
    PATCH,
    /** Lifecycle statistics committed. */
    MAINTENANCE,
    /** Current pointer moved to an earlier version. */
    ROLLBACK
}
