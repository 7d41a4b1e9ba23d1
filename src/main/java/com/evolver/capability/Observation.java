package com.evolver.capability;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of a successful action.
 *
 * @param actionName     action that produced it
 * @param payload        state changes and extracted data
 * @param durationMillis duration reported by the capability, used for timing metrics
 */
public record Observation(String actionName, Map<String, Object> payload, long durationMillis) {

    public Observation {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(payload));
        if (durationMillis < 0) {
            throw new IllegalArgumentException("Duration cannot be negative");
        }
    }

    public static Observation of(String actionName, long durationMillis) {
        return new Observation(actionName, Map.of(), durationMillis);
    }
}
