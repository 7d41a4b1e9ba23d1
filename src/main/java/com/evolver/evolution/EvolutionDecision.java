package com.evolver.evolution;

import com.evolver.simulation.SimulationResult;

import java.util.List;

/**
 * Controller verdict on one batch of simulated proposals.
 *
 * @param accepted   proposals to commit, in commit order
 * @param rejections everything else, with the reason
 */
public record EvolutionDecision(List<SimulationResult> accepted, List<Rejection> rejections) {

    public EvolutionDecision {
        accepted = List.copyOf(accepted);
        rejections = List.copyOf(rejections);
    }

    public static EvolutionDecision empty() {
        return new EvolutionDecision(List.of(), List.of());
    }

    public List<String> acceptedIds() {
        return accepted.stream().map(SimulationResult::proposalId).toList();
    }

    public List<Rejection> rejectedFor(RejectionReason reason) {
        return rejections.stream().filter(r -> r.reason() == reason).toList();
    }
}
