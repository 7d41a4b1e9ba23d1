package com.evolver.dag;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Record of which rules produced or constrained each DAG node.
 * Nodes decomposed directly from the goal carry no entry.
 */
public final class BuildTrace {

    private static final BuildTrace EMPTY = new BuildTrace(List.of());

    private final List<BuildTraceEntry> entries;

    public BuildTrace(List<BuildTraceEntry> entries) {
        this.entries = List.copyOf(new LinkedHashSet<>(entries));
    }

    public static BuildTrace empty() {
        return EMPTY;
    }

    public List<BuildTraceEntry> entries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public List<BuildTraceEntry> entriesFor(String nodeId) {
        List<BuildTraceEntry> result = new ArrayList<>();
        for (BuildTraceEntry entry : entries) {
            if (entry.nodeId().equals(nodeId)) {
                result.add(entry);
            }
        }
        return result;
    }

    /**
     * Sorted ids of rules that touched the node.
     */
    public Set<String> ruleIdsFor(String nodeId) {
        Set<String> ids = new TreeSet<>();
        for (BuildTraceEntry entry : entriesFor(nodeId)) {
            ids.add(entry.ruleId());
        }
        return ids;
    }

    public Set<String> appliedRuleIds() {
        Set<String> ids = new TreeSet<>();
        for (BuildTraceEntry entry : entries) {
            ids.add(entry.ruleId());
        }
        return ids;
    }

    @Override
    public String toString() {
        return "BuildTrace" + entries;
    }
}
