package com.evolver.dag;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A goal to be compiled into an action DAG.
 *
 * @param kind   goal category
 * @param target what the goal is about (URL, query, ...)
 * @param text   original description
 */
public record Goal(GoalKind kind, String target, String text) {

    private static final Pattern TARGET = Pattern.compile("\\b(?:to|for|from)\\s+(\\S.*)$", Pattern.CASE_INSENSITIVE);

    public Goal {
        if (kind == null) {
            throw new IllegalArgumentException("Goal kind cannot be null");
        }
        text = text == null ? "" : text;
        target = target == null || target.isBlank() ? text : target;
    }

    /**
     * Classify a free-text goal by keyword and pull out its target.
     * "browse to https://example.com" becomes BROWSE with target "https://example.com".
     */
    public static Goal parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Goal text cannot be blank");
        }
        String lower = text.toLowerCase(Locale.ROOT);
        GoalKind kind;
        if (lower.contains("browse") || lower.contains("navigate")) {
            kind = GoalKind.BROWSE;
        } else if (lower.contains("search")) {
            kind = GoalKind.SEARCH;
        } else if (lower.contains("extract") || lower.contains("scrape")) {
            kind = GoalKind.EXTRACT;
        } else {
            kind = GoalKind.GENERIC;
        }
        Matcher matcher = TARGET.matcher(text.trim());
        String target = matcher.find() ? matcher.group(1).trim() : text.trim();
        return new Goal(kind, target, text.trim());
    }
}
