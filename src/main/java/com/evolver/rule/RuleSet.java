package com.evolver.rule;

import com.evolver.condition.ConditionEvaluator;
import com.evolver.condition.DefaultConditionEvaluator;
import com.evolver.exception.CyclicOrderConstraintException;
import com.evolver.exception.DuplicateRuleIdException;
import com.evolver.state.WorldState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Ordered collection of rules keyed by id.
 * Working copy: snapshots hand out a fresh instance for every reader.
 */
public class RuleSet {

    /**
     * Deterministic applicability order: higher confidence first, then id.
     */
    public static final Comparator<Rule> APPLICATION_ORDER =
            Comparator.comparingDouble(Rule::confidence).reversed().thenComparing(Rule::id);

    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final ConditionEvaluator conditionEvaluator;

    public RuleSet() {
        this(DefaultConditionEvaluator.INSTANCE);
    }

    public RuleSet(ConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    /**
     * Build a rule set from an ordered list.
     *
     * @throws DuplicateRuleIdException if two rules share an id
     */
    public static RuleSet of(List<Rule> rules) {
        RuleSet set = new RuleSet();
        for (Rule rule : rules) {
            set.addRule(rule);
        }
        return set;
    }

    public void addRule(Rule rule) {
        if (rules.containsKey(rule.id())) {
            throw new DuplicateRuleIdException(rule.id());
        }
        rules.put(rule.id(), rule);
    }

    /**
     * Replace an existing rule in place, keeping its position.
     */
    public void replaceRule(Rule rule) {
        if (!rules.containsKey(rule.id())) {
            throw new IllegalArgumentException("No rule with id " + rule.id());
        }
        rules.put(rule.id(), rule);
    }

    public Optional<Rule> find(String id) {
        return Optional.ofNullable(rules.get(id));
    }

    public boolean contains(String id) {
        return rules.containsKey(id);
    }

    public List<Rule> rules() {
        return List.copyOf(rules.values());
    }

    public int size() {
        return rules.size();
    }

    /**
     * Rules that take part in planning and budgeting, i.e. everything not deprecated.
     */
    public int liveCount() {
        return (int) rules.values().stream().filter(r -> r.status() != RuleStatus.DEPRECATED).count();
    }

    public Map<RuleStatus, Integer> countsByStatus() {
        Map<RuleStatus, Integer> counts = new EnumMap<>(RuleStatus.class);
        for (RuleStatus status : RuleStatus.values()) {
            counts.put(status, 0);
        }
        for (Rule rule : rules.values()) {
            counts.merge(rule.status(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * ACTIVE rules whose conditions all hold over {@code state}, ordered by descending
     * confidence then id.
     */
    public List<Rule> applicableRules(WorldState state) {
        List<Rule> applicable = new ArrayList<>();
        for (Rule rule : rules.values()) {
            if (rule.status() == RuleStatus.ACTIVE
                    && conditionEvaluator.evaluateAll(rule.conditions(), state)) {
                applicable.add(rule);
            }
        }
        applicable.sort(APPLICATION_ORDER);
        return applicable;
    }

    /**
     * Check that order constraints of non-deprecated rules do not form a cycle.
     *
     * @throws CyclicOrderConstraintException naming the cycle found
     */
    public void validate() {
        // action -> actions that must precede it
        Map<String, Set<String>> mustFollow = new TreeMap<>();
        for (Rule rule : rules.values()) {
            if (rule.status() == RuleStatus.DEPRECATED || !rule.hasOrderConstraint()) {
                continue;
            }
            mustFollow.computeIfAbsent(rule.action(), k -> new TreeSet<>()).addAll(rule.predecessors());
        }

        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        for (String action : mustFollow.keySet()) {
            List<String> path = new ArrayList<>();
            findCycle(action, mustFollow, state, path);
        }
    }

    private void findCycle(String action, Map<String, Set<String>> mustFollow,
                           Map<String, Integer> state, List<String> path) {
        Integer mark = state.get(action);
        if (mark != null && mark == 2) {
            return;
        }
        if (mark != null && mark == 1) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(action), path.size()));
            cycle.add(action);
            throw new CyclicOrderConstraintException(cycle);
        }
        state.put(action, 1);
        path.add(action);
        for (String predecessor : mustFollow.getOrDefault(action, Set.of())) {
            findCycle(predecessor, mustFollow, state, path);
        }
        path.remove(path.size() - 1);
        state.put(action, 2);
    }
}
