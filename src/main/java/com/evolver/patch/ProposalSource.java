package com.evolver.patch;

public enum ProposalSource {
    /** Deterministic trace-based reflection. */
    REFLECTION,
    /** External advisor. */
    ADVISOR
}
