package com.evolver.simulation;

import com.evolver.patch.PatchProposal;
import com.evolver.rule.Rule;

import java.util.List;

/**
 * Outcome of simulating one proposal against the version it was forked from.
 *
 * @param proposal      simulated proposal
 * @param baseVersionId version the fork was taken from
 * @param baseline      metrics of the unpatched rules
 * @param patched       metrics of the forked rules
 * @param diff          patched minus baseline
 * @param patchedRules  rules of the fork
 */
public record SimulationResult(
        PatchProposal proposal,
        String baseVersionId,
        SimulationMetrics baseline,
        SimulationMetrics patched,
        WorldModelDiff diff,
        List<Rule> patchedRules
) {
    public SimulationResult {
        patchedRules = List.copyOf(patchedRules);
    }

    public String proposalId() {
        return proposal.id();
    }
}
