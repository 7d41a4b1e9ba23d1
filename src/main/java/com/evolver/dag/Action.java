package com.evolver.dag;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable action: a capability name plus parameters.
 *
 * @param name   capability action name, e.g. "browser.open"
 * @param params action parameters
 */
public record Action(String name, Map<String, Object> params) {

    public Action {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action name cannot be blank");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(params));
    }

    public static Action of(String name) {
        return new Action(name, Map.of());
    }

    public static Action of(String name, Map<String, Object> params) {
        return new Action(name, params);
    }

    @Override
    public String toString() {
        return params.isEmpty() ? name : name + params;
    }
}
