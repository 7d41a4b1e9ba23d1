package com.evolver.dag;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in decomposers for each goal kind.
 */
public final class GoalDecomposers {

    private GoalDecomposers() {
    }

    public static GoalDecomposer browse() {
        return goal -> List.of(Action.of("browser.open", Map.of("url", goal.target())));
    }

    public static GoalDecomposer search() {
        return goal -> List.of(
                Action.of("browser.open", Map.of("url", "search")),
                Action.of("browser.fill", Map.of("selector", "#search", "value", goal.target())),
                Action.of("browser.click", Map.of("selector", "#search-button")));
    }

    public static GoalDecomposer extract() {
        return goal -> List.of(
                Action.of("browser.open", Map.of("url", goal.target())),
                Action.of("browser.extract", Map.of("selector", "body")),
                Action.of("filesystem.write", Map.of("path", "extracted.txt")));
    }

    public static GoalDecomposer generic() {
        return goal -> List.of(Action.of("generic.execute", Map.of("goal", goal.text())));
    }

    public static Map<GoalKind, GoalDecomposer> defaults() {
        Map<GoalKind, GoalDecomposer> map = new EnumMap<>(GoalKind.class);
        map.put(GoalKind.BROWSE, browse());
        map.put(GoalKind.SEARCH, search());
        map.put(GoalKind.EXTRACT, extract());
        map.put(GoalKind.GENERIC, generic());
        return map;
    }
}
