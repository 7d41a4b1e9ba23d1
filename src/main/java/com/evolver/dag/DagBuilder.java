package com.evolver.dag;

import com.evolver.exception.RuleConflictException;
import com.evolver.exception.UnsatisfiableGoalException;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a goal plus the current rule set into an {@link ActionDAG}.
 *
 * <p>The goal is decomposed into a seed chain. Every node then passes through the
 * applicable rules targeting its action: unmet required state pulls in a producer (an
 * existing node or a catalog action), and order constraints add predecessor edges.
 * Each structural change is recorded in the {@link BuildTrace}.
 */
public class DagBuilder {

    private static final Logger log = LoggerFactory.getLogger(DagBuilder.class);

    private static final int DEFAULT_MAX_NODES = 256;

    private final ActionCatalog catalog;
    private final Map<GoalKind, GoalDecomposer> decomposers;
    private final int maxNodes;

    public DagBuilder(ActionCatalog catalog) {
        this(catalog, GoalDecomposers.defaults(), DEFAULT_MAX_NODES);
    }

    public DagBuilder(ActionCatalog catalog, Map<GoalKind, GoalDecomposer> decomposers, int maxNodes) {
        this.catalog = catalog;
        this.decomposers = new EnumMap<>(GoalKind.class);
        this.decomposers.putAll(decomposers);
        this.maxNodes = maxNodes;
    }

    /**
     * Register (or replace) the decomposer for a goal kind.
     */
    public void registerDecomposer(GoalKind kind, GoalDecomposer decomposer) {
        decomposers.put(kind, decomposer);
    }

    public BuildResult build(String goalText, RuleSet rules, WorldState state) {
        return build(Goal.parse(goalText), rules, state);
    }

    /**
     * Build the DAG for {@code goal}.
     *
     * @throws UnsatisfiableGoalException if a required state has no producing action
     * @throws RuleConflictException if two applicable rules require different values for one key
     * @throws com.evolver.exception.CyclicOrderConstraintException if the constraints form a cycle
     */
    public BuildResult build(Goal goal, RuleSet rules, WorldState state) {
        WorldState planningState = state
                .with(WorldState.GOAL_KIND, goal.kind().stateValue())
                .with(WorldState.GOAL_TARGET, goal.target());
        List<Rule> applicable = rules.applicableRules(planningState);

        GoalDecomposer decomposer = decomposers.getOrDefault(goal.kind(), decomposers.get(GoalKind.GENERIC));
        if (decomposer == null) {
            throw new UnsatisfiableGoalException("No decomposer for goal kind " + goal.kind());
        }
        List<Action> seed = decomposer.decompose(goal);
        if (seed == null || seed.isEmpty()) {
            throw new UnsatisfiableGoalException("Goal '" + goal.text() + "' decomposes to no actions");
        }

        Graph graph = new Graph();
        Deque<String> worklist = new ArrayDeque<>();
        String previous = null;
        for (Action action : seed) {
            String id = graph.add(action);
            if (previous != null) {
                graph.edge(previous, id);
            }
            worklist.add(id);
            previous = id;
        }

        Map<String, Requirement> requirements = new HashMap<>();
        while (!worklist.isEmpty()) {
            String nodeId = worklist.poll();
            String actionName = graph.action(nodeId).name();
            for (Rule rule : applicable) {
                if (!rule.action().equals(actionName)) {
                    continue;
                }
                switch (rule.kind()) {
                    case PRECONDITION -> {
                        enforceRequirements(rule, nodeId, graph, planningState, requirements, worklist);
                        injectPredecessors(rule, graph, worklist);
                    }
                    case ORDER -> injectPredecessors(rule, graph, worklist);
                }
            }
            if (graph.size() > maxNodes) {
                throw new UnsatisfiableGoalException("Goal '" + goal.text() + "' expands beyond "
                        + maxNodes + " nodes");
            }
        }

        addOrderEdges(applicable, graph);

        ActionDAG dag = graph.toDag();
        BuildTrace trace = new BuildTrace(graph.trace);
        log.debug("Built DAG for '{}' ({}): {} nodes, {} edges, {} trace entries",
                goal.text(), goal.kind(), dag.size(), dag.edgeCount(), trace.size());
        return new BuildResult(goal, dag, trace, planningState);
    }

    private void enforceRequirements(Rule rule, String nodeId, Graph graph, WorldState state,
                                     Map<String, Requirement> requirements, Deque<String> worklist) {
        String actionName = graph.action(nodeId).name();
        for (Map.Entry<String, Object> required : rule.requires().entrySet()) {
            String key = required.getKey();
            Object value = required.getValue();

            Requirement existing = requirements.putIfAbsent(key, new Requirement(rule.id(), value));
            if (existing != null && !WorldState.sameValue(existing.value(), value)) {
                throw new RuleConflictException(key, existing.ruleId(), existing.value(), rule.id(), value);
            }

            if (state.satisfies(key, value)) {
                continue;
            }

            Optional<String> producer = graph.findProducer(key, value, nodeId);
            String producerId;
            if (producer.isPresent()) {
                producerId = producer.get();
            } else {
                ActionTemplate template = catalog.producerOf(key, value)
                        .filter(t -> !t.name().equals(actionName))
                        .orElseThrow(() -> new UnsatisfiableGoalException("Rule '" + rule.id() + "' requires "
                                + key + "=" + value + " before " + actionName + " but no action produces it"));
                producerId = graph.add(template.toAction());
                graph.trace(producerId, rule, TraceKind.INJECTED,
                        "produces " + key + "=" + value + " required by " + actionName);
                worklist.add(producerId);
            }
            graph.edge(producerId, nodeId);
            graph.trace(nodeId, rule, TraceKind.CONSTRAINED,
                    "requires " + key + "=" + value + ", waits on " + producerId);
        }
    }

    private void injectPredecessors(Rule rule, Graph graph, Deque<String> worklist) {
        for (String predecessor : rule.predecessors()) {
            if (!graph.nodesRunning(predecessor).isEmpty()) {
                continue;
            }
            Optional<ActionTemplate> template = catalog.template(predecessor);
            if (template.isEmpty()) {
                log.debug("Rule '{}' orders {} after unknown action {}, ignoring", rule.id(), rule.action(), predecessor);
                continue;
            }
            String id = graph.add(template.get().toAction());
            graph.trace(id, rule, TraceKind.INJECTED, "must run before " + rule.action());
            worklist.add(id);
        }
    }

    private void addOrderEdges(List<Rule> applicable, Graph graph) {
        for (Rule rule : applicable) {
            if (!rule.hasOrderConstraint()) {
                continue;
            }
            for (String nodeId : graph.nodesRunning(rule.action())) {
                for (String predecessor : rule.predecessors()) {
                    for (String predId : graph.nodesRunning(predecessor)) {
                        if (!predId.equals(nodeId)) {
                            graph.edge(predId, nodeId);
                            graph.trace(nodeId, rule, TraceKind.CONSTRAINED,
                                    "ordered after " + predecessor + " (" + predId + ")");
                        }
                    }
                }
            }
        }
    }

    private record Requirement(String ruleId, Object value) {
    }

    /**
     * Mutable graph under construction.
     */
    private final class Graph {
        private final Map<String, Action> actions = new LinkedHashMap<>();
        private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();
        private final List<BuildTraceEntry> trace = new ArrayList<>();

        String add(Action action) {
            String id = "n" + (actions.size() + 1);
            actions.put(id, action);
            predecessors.put(id, new LinkedHashSet<>());
            return id;
        }

        Action action(String id) {
            return actions.get(id);
        }

        int size() {
            return actions.size();
        }

        void edge(String from, String to) {
            predecessors.get(to).add(from);
        }

        void trace(String nodeId, Rule rule, TraceKind kind, String rationale) {
            trace.add(new BuildTraceEntry(nodeId, actions.get(nodeId).name(), rule.id(), kind, rationale));
        }

        List<String> nodesRunning(String actionName) {
            List<String> ids = new ArrayList<>();
            actions.forEach((id, action) -> {
                if (action.name().equals(actionName)) {
                    ids.add(id);
                }
            });
            return ids;
        }

        /**
         * First node producing {@code key=value} that can still run before {@code consumer};
         * nodes already waiting on the consumer are passed over.
         */
        Optional<String> findProducer(String key, Object value, String consumer) {
            for (Map.Entry<String, Action> entry : actions.entrySet()) {
                String id = entry.getKey();
                if (!id.equals(consumer) && catalog.produces(entry.getValue().name(), key, value)
                        && !dependsOn(id, consumer)) {
                    return Optional.of(id);
                }
            }
            return Optional.empty();
        }

        boolean dependsOn(String nodeId, String ancestor) {
            Deque<String> pending = new ArrayDeque<>(predecessors.get(nodeId));
            Set<String> seen = new HashSet<>();
            while (!pending.isEmpty()) {
                String id = pending.pop();
                if (id.equals(ancestor)) {
                    return true;
                }
                if (seen.add(id)) {
                    pending.addAll(predecessors.get(id));
                }
            }
            return false;
        }

        ActionDAG toDag() {
            List<ActionNode> nodes = new ArrayList<>();
            actions.forEach((id, action) -> nodes.add(new ActionNode(id, action, predecessors.get(id))));
            return new ActionDAG(nodes);
        }
    }
}
