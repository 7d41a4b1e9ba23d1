package com.evolver.patch;

/**
 * Primitive rule edits a patch can carry.
 */
public enum EditKind {
    ADD_CONDITION,
    ADD_ORDER_CONSTRAINT,
    NARROW_SCOPE,
    DEPRECATE_RULE,
    ADD_RULE;

    /**
     * Whether the edit targets an existing rule (everything except ADD_RULE).
     */
    public boolean targetsExistingRule() {
        return this != ADD_RULE;
    }
}
