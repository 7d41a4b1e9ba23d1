package com.evolver.capability;

import com.evolver.state.WorldState;

/**
 * Hands out the capability one task executes against.
 * Stateful environments return a fresh session per task so concurrent runs stay isolated.
 */
@FunctionalInterface
public interface CapabilityProvider {

    Capability open(String taskId, WorldState initialState);

    /**
     * Provider that always returns the same stateless capability.
     */
    static CapabilityProvider shared(Capability capability) {
        return (taskId, initialState) -> capability;
    }
}
