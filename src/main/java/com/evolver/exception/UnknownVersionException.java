package com.evolver.exception;

/**
 * Thrown when a version id was never recorded in the world model.
 */
public class UnknownVersionException extends EvolverException {

    private final String versionId;

    public UnknownVersionException(String versionId) {
        super("Unknown world model version: " + versionId);
        this.versionId = versionId;
    }

    public String getVersionId() {
        return versionId;
    }
}
