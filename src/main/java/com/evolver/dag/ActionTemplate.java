package com.evolver.dag;

import com.evolver.state.WorldState;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Catalog entry describing an action the capability layer offers and the state it
 * establishes when it succeeds.
 *
 * @param name    action name
 * @param params  default parameters used when the action is injected
 * @param effects state keys the action sets on success
 */
public record ActionTemplate(String name, Map<String, Object> params, Map<String, Object> effects) {

    public ActionTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Action template name cannot be blank");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(params));
        effects = effects == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(effects));
    }

    public boolean produces(String key, Object value) {
        return effects.containsKey(key) && WorldState.sameValue(effects.get(key), value);
    }

    public Action toAction() {
        return new Action(name, params);
    }
}
