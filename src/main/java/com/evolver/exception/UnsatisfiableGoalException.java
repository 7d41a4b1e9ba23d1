package com.evolver.exception;

/**
 * Thrown when a hard precondition of a planned action has no producing action.
 */
public class UnsatisfiableGoalException extends EvolverException {

    public UnsatisfiableGoalException(String message) {
        super(message);
    }
}
