package com.evolver.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Snapshot of world-state keys that rule conditions are evaluated against.
 * Immutable after creation.
 */
public final class WorldState {

    public static final String GOAL_KIND = "goal.kind";
    public static final String GOAL_TARGET = "goal.target";

    private static final WorldState EMPTY = new WorldState(Map.of());

    private final Map<String, Object> values;

    private WorldState(Map<String, Object> values) {
        // Sorted so toString and iteration are reproducible
        this.values = Collections.unmodifiableMap(new TreeMap<>(values));
    }

    public static WorldState empty() {
        return EMPTY;
    }

    public static WorldState of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return new WorldState(copy);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Check whether the key holds the given value, comparing numbers by value and
     * everything else by string form.
     */
    public boolean satisfies(String key, Object expected) {
        Object actual = values.get(key);
        return actual != null && sameValue(actual, expected);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Return a copy with the given key set.
     */
    public WorldState with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(key, value);
        return new WorldState(copy);
    }

    public WorldState withAll(Map<String, ?> more) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        more.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return new WorldState(copy);
    }

    public static boolean sameValue(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) {
            return true;
        }
        if (actual == null || expected == null) {
            return false;
        }
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorldState other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "WorldState" + values;
    }
}
