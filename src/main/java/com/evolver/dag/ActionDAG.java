package com.evolver.dag;

import com.evolver.exception.CyclicOrderConstraintException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Immutable dependency graph of actions.
 *
 * <p>Invariants checked at construction: every predecessor id resolves within the graph
 * and the graph is acyclic. Node order is insertion order, which also breaks ties in
 * {@link #topologicalOrder()}.
 */
public final class ActionDAG {

    private final Map<String, ActionNode> nodes;
    private final Map<String, Integer> position;
    private final Map<String, Set<String>> successors;

    public ActionDAG(List<ActionNode> nodeList) {
        Map<String, ActionNode> byId = new LinkedHashMap<>();
        for (ActionNode node : nodeList) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id: " + node.id());
            }
        }
        Map<String, Integer> pos = new HashMap<>();
        Map<String, Set<String>> succ = new LinkedHashMap<>();
        int i = 0;
        for (ActionNode node : byId.values()) {
            pos.put(node.id(), i++);
            succ.put(node.id(), new LinkedHashSet<>());
        }
        for (ActionNode node : byId.values()) {
            for (String pred : node.predecessors()) {
                if (!byId.containsKey(pred)) {
                    throw new IllegalArgumentException(
                            "Node '" + node.id() + "' references unknown predecessor '" + pred + "'");
                }
                succ.get(pred).add(node.id());
            }
        }
        this.nodes = Collections.unmodifiableMap(byId);
        this.position = pos;
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        succ.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSet(v)));
        this.successors = Collections.unmodifiableMap(frozen);

        validateAcyclic();
    }

    public static ActionDAG empty() {
        return new ActionDAG(List.of());
    }

    public List<ActionNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public ActionNode node(String id) {
        ActionNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Set<String> successors(String id) {
        return successors.getOrDefault(id, Set.of());
    }

    public int edgeCount() {
        return nodes.values().stream().mapToInt(n -> n.predecessors().size()).sum();
    }

    /**
     * Every node reachable from {@code id} through successor edges, excluding {@code id}.
     */
    public Set<String> descendants(String id) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>(successors(id));
        while (!stack.isEmpty()) {
            String next = stack.pop();
            if (seen.add(next)) {
                stack.addAll(successors(next));
            }
        }
        return seen;
    }

    /**
     * Kahn ordering with insertion order as tie-break.
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> indegree = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> position.get(a) - position.get(b));
        for (ActionNode node : nodes.values()) {
            indegree.put(node.id(), node.predecessors().size());
            if (node.predecessors().isEmpty()) {
                ready.add(node.id());
            }
        }
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String succ : successors(id)) {
                if (indegree.merge(succ, -1, Integer::sum) == 0) {
                    ready.add(succ);
                }
            }
        }
        return order;
    }

    /**
     * Compare two node ids by insertion order.
     */
    public int compareByPosition(String a, String b) {
        return Integer.compare(position.get(a), position.get(b));
    }

    private void validateAcyclic() {
        if (topologicalOrder().size() == nodes.size()) {
            return;
        }
        // Walk predecessor links from a node left over by Kahn's algorithm to name the cycle
        Set<String> ordered = new LinkedHashSet<>(topologicalOrder());
        String start = nodes.keySet().stream().filter(id -> !ordered.contains(id)).findFirst().orElseThrow();
        List<String> path = new ArrayList<>();
        String current = start;
        while (!path.contains(current)) {
            path.add(current);
            String cur = current;
            current = nodes.get(cur).predecessors().stream()
                    .filter(p -> !ordered.contains(p))
                    .findFirst()
                    .orElseThrow();
        }
        List<String> cycle = new ArrayList<>();
        for (String id : path.subList(path.indexOf(current), path.size())) {
            cycle.add(id + ":" + nodes.get(id).actionName());
        }
        cycle.add(current + ":" + nodes.get(current).actionName());
        Collections.reverse(cycle);
        throw new CyclicOrderConstraintException(cycle);
    }

    @Override
    public String toString() {
        return "ActionDAG" + nodes.values();
    }
}
