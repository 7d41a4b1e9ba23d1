package com.evolver.dag;

/**
 * How a rule shaped a DAG node.
 */
public enum TraceKind {
    /** The rule caused the node to be added. */
    INJECTED,
    /** The rule added predecessor edges to an existing node. */
    CONSTRAINED
}
