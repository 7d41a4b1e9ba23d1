package com.evolver.exception;

/**
 * Thrown when a patch proposal fails schema or whitelist validation, or references an
 * unknown rule. Such proposals are dropped from the candidate set.
 */
public class InvalidProposalException extends EvolverException {

    private final String proposalId;

    public InvalidProposalException(String proposalId, String message) {
        super("Invalid proposal '" + proposalId + "': " + message);
        this.proposalId = proposalId;
    }

    public String getProposalId() {
        return proposalId;
    }
}
