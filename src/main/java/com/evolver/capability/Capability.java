package com.evolver.capability;

import com.evolver.dag.Action;
import com.evolver.exception.ActionFailureException;

/**
 * Executes a single action against the outside world.
 *
 * <p>Implementations may be called from several engine workers at once.
 */
public interface Capability {

    /**
     * @throws ActionFailureException if the action cannot be carried out
     */
    Observation execute(Action action);
}
