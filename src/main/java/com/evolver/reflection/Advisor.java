package com.evolver.reflection;

import com.evolver.patch.PatchProposal;

import java.util.List;

/**
 * External source of patch candidates. Never writes to the model; its output is
 * validated and simulated like any other proposal.
 */
@FunctionalInterface
public interface Advisor {

    List<PatchProposal> propose(FailureContext context);
}
