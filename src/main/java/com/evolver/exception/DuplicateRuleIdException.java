package com.evolver.exception;

/**
 * Thrown when a rule is added under an id the rule set already holds.
 */
public class DuplicateRuleIdException extends EvolverException {

    private final String ruleId;

    public DuplicateRuleIdException(String ruleId) {
        super("Duplicate rule id: " + ruleId);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
