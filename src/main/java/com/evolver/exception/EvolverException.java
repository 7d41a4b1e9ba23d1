package com.evolver.exception;

/**
 * Base exception for the Evolver framework.
 */
public class EvolverException extends RuntimeException {

    public EvolverException(String message) {
        super(message);
    }

    public EvolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
