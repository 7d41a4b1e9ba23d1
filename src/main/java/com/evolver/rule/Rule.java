package com.evolver.rule;

import com.evolver.condition.ConditionSpec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Atomic unit of behavioral knowledge.
 *
 * <p>A rule governs one target {@code action}. It applies only while all of its
 * {@code conditions} hold over the world state. PRECONDITION rules carry the state the
 * action needs ({@code requires}); any rule may carry an order constraint, the actions
 * that must complete before the target action ({@code predecessors}).
 *
 * @param id           unique rule id
 * @param kind         tagged rule kind
 * @param action       target action name
 * @param conditions   applicability conditions, all must hold
 * @param requires     required state before the action (PRECONDITION)
 * @param predecessors required predecessor action names (order constraint)
 * @param description  free text
 * @param metadata     statistics and lifecycle
 */
public record Rule(
        String id,
        RuleKind kind,
        String action,
        List<ConditionSpec> conditions,
        Map<String, Object> requires,
        List<String> predecessors,
        String description,
        RuleMetadata metadata
) {
    public Rule {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Rule id cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Rule '" + id + "' has no kind");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Rule '" + id + "' has no target action");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("Rule '" + id + "' has no metadata");
        }
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        requires = requires == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(requires));
        predecessors = predecessors == null ? List.of() : List.copyOf(new LinkedHashSet<>(predecessors));
        description = description == null ? "" : description;

        switch (kind) {
            case PRECONDITION -> {
                if (requires.isEmpty()) {
                    throw new IllegalArgumentException("Precondition rule '" + id + "' requires no state");
                }
            }
            case ORDER -> {
                if (predecessors.isEmpty()) {
                    throw new IllegalArgumentException("Order rule '" + id + "' names no predecessors");
                }
            }
        }
        if (predecessors.contains(action)) {
            throw new IllegalArgumentException("Rule '" + id + "' orders action '" + action + "' after itself");
        }
    }

    public static Rule precondition(String id, String action, Map<String, Object> requires, RuleMetadata metadata) {
        return new Rule(id, RuleKind.PRECONDITION, action, List.of(), requires, List.of(), "", metadata);
    }

    public static Rule order(String id, String action, List<String> predecessors, RuleMetadata metadata) {
        return new Rule(id, RuleKind.ORDER, action, List.of(), Map.of(), predecessors, "", metadata);
    }

    public RuleStatus status() {
        return metadata.status();
    }

    public double confidence() {
        return metadata.confidence();
    }

    public boolean hasOrderConstraint() {
        return !predecessors.isEmpty();
    }

    public int conditionCount() {
        return conditions.size();
    }

    public Rule withCondition(ConditionSpec condition) {
        List<ConditionSpec> next = new ArrayList<>(conditions);
        next.add(condition);
        return new Rule(id, kind, action, next, requires, predecessors, description, metadata);
    }

    public Rule withPredecessors(List<String> extra) {
        List<String> next = new ArrayList<>(predecessors);
        next.addAll(extra);
        return new Rule(id, kind, action, conditions, requires, next, description, metadata);
    }

    public Rule withDescription(String text) {
        return new Rule(id, kind, action, conditions, requires, predecessors, text, metadata);
    }

    public Rule withMetadata(RuleMetadata next) {
        return new Rule(id, kind, action, conditions, requires, predecessors, description, next);
    }
}
