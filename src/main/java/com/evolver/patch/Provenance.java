package com.evolver.patch;

/**
 * Where a proposal came from.
 *
 * @param source    generator
 * @param taskId    task whose failure triggered it, may be null
 * @param versionId model version the failing run used
 */
public record Provenance(ProposalSource source, String taskId, String versionId) {

    public Provenance {
        if (source == null) {
            throw new IllegalArgumentException("Provenance source cannot be null");
        }
    }
}
