package com.evolver.dag;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Known actions and their effects, indexed by name.
 */
public final class ActionCatalog {

    private static final ActionCatalog EMPTY = new ActionCatalog(List.of());

    private final Map<String, ActionTemplate> templates;

    public ActionCatalog(Collection<ActionTemplate> templates) {
        Map<String, ActionTemplate> byName = new TreeMap<>();
        for (ActionTemplate template : templates) {
            if (byName.putIfAbsent(template.name(), template) != null) {
                throw new IllegalArgumentException("Duplicate action template: " + template.name());
            }
        }
        this.templates = byName;
    }

    public static ActionCatalog empty() {
        return EMPTY;
    }

    public Optional<ActionTemplate> template(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    /**
     * First action (by name) whose effects establish {@code key = value}.
     */
    public Optional<ActionTemplate> producerOf(String key, Object value) {
        return templates.values().stream()
                .filter(t -> t.produces(key, value))
                .findFirst();
    }

    public boolean produces(String actionName, String key, Object value) {
        ActionTemplate template = templates.get(actionName);
        return template != null && template.produces(key, value);
    }

    public Collection<ActionTemplate> templates() {
        return templates.values();
    }

    public int size() {
        return templates.size();
    }
}
