package com.evolver.patch;

import com.evolver.condition.ConditionSpec;
import com.evolver.rule.Rule;

import java.util.List;

/**
 * One primitive edit. Which fields are set depends on {@link #kind()}:
 * conditions for ADD_CONDITION and NARROW_SCOPE, predecessors for ADD_ORDER_CONSTRAINT,
 * the full rule for ADD_RULE.
 */
public record PatchEdit(
        EditKind kind,
        String ruleId,
        ConditionSpec condition,
        List<String> predecessors,
        Rule rule
) {
    public PatchEdit {
        if (kind == null) {
            throw new IllegalArgumentException("Edit kind cannot be null");
        }
        predecessors = predecessors == null ? List.of() : List.copyOf(predecessors);
        if (kind == EditKind.ADD_RULE && rule != null) {
            ruleId = rule.id();
        }
        if (ruleId == null || ruleId.isBlank()) {
            throw new IllegalArgumentException(kind + " edit has no rule id");
        }
        switch (kind) {
            case ADD_CONDITION, NARROW_SCOPE -> {
                if (condition == null) {
                    throw new IllegalArgumentException(kind + " edit on '" + ruleId + "' has no condition");
                }
            }
            case ADD_ORDER_CONSTRAINT -> {
                if (predecessors.isEmpty()) {
                    throw new IllegalArgumentException(kind + " edit on '" + ruleId + "' has no predecessors");
                }
            }
            case ADD_RULE -> {
                if (rule == null) {
                    throw new IllegalArgumentException("ADD_RULE edit has no rule");
                }
            }
            case DEPRECATE_RULE -> {
            }
        }
    }

    public static PatchEdit addCondition(String ruleId, ConditionSpec condition) {
        return new PatchEdit(EditKind.ADD_CONDITION, ruleId, condition, List.of(), null);
    }

    public static PatchEdit addOrderConstraint(String ruleId, List<String> predecessors) {
        return new PatchEdit(EditKind.ADD_ORDER_CONSTRAINT, ruleId, null, predecessors, null);
    }

    public static PatchEdit narrowScope(String ruleId, ConditionSpec exclusion) {
        return new PatchEdit(EditKind.NARROW_SCOPE, ruleId, exclusion, List.of(), null);
    }

    public static PatchEdit deprecateRule(String ruleId) {
        return new PatchEdit(EditKind.DEPRECATE_RULE, ruleId, null, List.of(), null);
    }

    public static PatchEdit addRule(Rule rule) {
        return new PatchEdit(EditKind.ADD_RULE, rule.id(), null, List.of(), rule);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ADD_CONDITION, NARROW_SCOPE -> kind + "(" + ruleId + ", " + condition + ")";
            case ADD_ORDER_CONSTRAINT -> kind + "(" + ruleId + ", after " + predecessors + ")";
            case DEPRECATE_RULE -> kind + "(" + ruleId + ")";
            case ADD_RULE -> kind + "(" + ruleId + " on " + rule.action() + ")";
        };
    }
}
