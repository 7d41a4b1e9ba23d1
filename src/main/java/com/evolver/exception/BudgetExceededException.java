package com.evolver.exception;

/**
 * Thrown when accepting a proposal would exceed the rolling patch budget.
 */
public class BudgetExceededException extends EvolverException {

    private final String proposalId;

    public BudgetExceededException(String proposalId, String message) {
        super("Budget exceeded for '" + proposalId + "': " + message);
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
