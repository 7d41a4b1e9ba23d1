package com.evolver.capability;

import com.evolver.dag.Action;
import com.evolver.exception.ActionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * Routes actions to capabilities by action-name prefix ({@code browser.}, {@code filesystem.}).
 * The longest matching prefix wins.
 */
public class CapabilityRegistry implements Capability {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, Capability> byPrefix = new TreeMap<>();

    public CapabilityRegistry register(String prefix, Capability capability) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Capability prefix cannot be blank");
        }
        byPrefix.put(prefix, capability);
        log.debug("Registered capability for prefix '{}': {}", prefix, capability.getClass().getSimpleName());
        return this;
    }

    @Override
    public Observation execute(Action action) {
        return resolve(action.name()).execute(action);
    }

    Capability resolve(String actionName) {
        Capability match = null;
        int matchLength = -1;
        for (Map.Entry<String, Capability> entry : byPrefix.entrySet()) {
            String prefix = entry.getKey();
            if (actionName.startsWith(prefix) && prefix.length() > matchLength) {
                match = entry.getValue();
                matchLength = prefix.length();
            }
        }
        if (match == null) {
            throw new ActionFailureException(FailureKind.ERROR, "No capability handles action " + actionName);
        }
        return match;
    }
}
