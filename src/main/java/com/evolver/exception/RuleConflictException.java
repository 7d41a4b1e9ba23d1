package com.evolver.exception;

/**
 * Thrown when two applicable rules require different values for the same state key.
 */
public class RuleConflictException extends EvolverException {

    private final String stateKey;
    private final String firstRuleId;
    private final String secondRuleId;

    public RuleConflictException(String stateKey, String firstRuleId, Object firstValue,
                                 String secondRuleId, Object secondValue) {
        super("Rules '" + firstRuleId + "' and '" + secondRuleId + "' conflict on '" + stateKey
                + "': " + firstValue + " vs " + secondValue);
        this.stateKey = stateKey;
        this.firstRuleId = firstRuleId;
        this.secondRuleId = secondRuleId;
    }

    public String getStateKey() {
        return stateKey;
    }

    public String getFirstRuleId() {
        return firstRuleId;
    }

    public String getSecondRuleId() {
        return secondRuleId;
    }
}
