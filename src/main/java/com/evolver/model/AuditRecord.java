package com.evolver.model;

import com.evolver.patch.PatchProposal;
import com.evolver.simulation.WorldModelDiff;

import java.time.Instant;
import java.util.Optional;

/**
 * Append-only record of one change to the world model.
 *
 * @param kind        what happened
 * @param versionId   version current after the change
 * @param fromVersion version current before the change, null for INIT
 * @param proposal    committed proposal, PATCH only
 * @param diff        simulated effect of the proposal, PATCH only
 * @param note        free text
 * @param timestamp   when it happened
 */
public record AuditRecord(
        AuditKind kind,
        String versionId,
        String fromVersion,
        PatchProposal proposal,
        WorldModelDiff diff,
        String note,
        Instant timestamp
) {
    public AuditRecord {
        if (kind == null || versionId == null) {
            throw new IllegalArgumentException("Audit record needs a kind and a version");
        }
        note = note == null ? "" : note;
    }

    public Optional<PatchProposal> proposalOpt() {
        return Optional.ofNullable(proposal);
    }
}
