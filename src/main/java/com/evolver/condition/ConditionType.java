package com.evolver.condition;

/**
 * Supported condition types for rule applicability.
 */
public enum ConditionType {
    // Comparison
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    GREATER_THAN_OR_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUALS,

    // Collection
    IN,
    NOT_IN,

    // Existence
    EXISTS,

    // Logical
    AND,
    OR,
    NOT,

    // Special
    ALWAYS_TRUE;

    public boolean isLogical() {
        return this == AND || this == OR || this == NOT;
    }
}
