package com.evolver.rule;

/**
 * Kind of behavioral knowledge a rule carries.
 */
public enum RuleKind {
    /** Required world state before the target action runs. */
    PRECONDITION,
    /** Actions that must run before the target action. */
    ORDER
}
