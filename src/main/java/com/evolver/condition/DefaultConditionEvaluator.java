package com.evolver.condition;

import com.evolver.condition.impl.*;
import com.evolver.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Default implementation of ConditionEvaluator.
 * Factory that creates Condition instances from specifications.
 */
public class DefaultConditionEvaluator implements ConditionEvaluator {

    public static final DefaultConditionEvaluator INSTANCE = new DefaultConditionEvaluator();

    @Override
    public Condition create(ConditionSpec spec) {
        if (spec == null) {
            throw new ConfigurationException("Condition specification cannot be null");
        }

        ConditionType type = spec.type();
        if (type == null) {
            throw new ConfigurationException("Condition type cannot be null");
        }

        return switch (type) {
            case ALWAYS_TRUE -> AlwaysTrueCondition.INSTANCE;

            case EQUALS -> createEqualsCondition(spec);
            case NOT_EQUALS -> createNotEqualsCondition(spec);

            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS ->
                    createComparisonCondition(spec);

            case IN -> createInCondition(spec, false);
            case NOT_IN -> createInCondition(spec, true);

            case EXISTS -> createExistsCondition(spec);

            case AND -> new AndCondition(createNested(spec));
            case OR -> new OrCondition(createNested(spec));
            case NOT -> createNotCondition(spec);
        };
    }

    /**
     * Validate a specification without keeping the compiled condition.
     */
    public void validate(ConditionSpec spec) {
        create(spec);
    }

    private Condition createEqualsCondition(ConditionSpec spec) {
        validateField(spec);
        validateValue(spec);
        return new EqualsCondition(spec.field(), spec.value());
    }

    private Condition createNotEqualsCondition(ConditionSpec spec) {
        validateField(spec);
        validateValue(spec);
        return new NotEqualsCondition(spec.field(), spec.value());
    }

    private Condition createComparisonCondition(ConditionSpec spec) {
        validateField(spec);
        if (!(spec.value() instanceof Number threshold)) {
            throw new ConfigurationException(spec.type() + " condition requires a numeric value");
        }
        return new ComparisonCondition(spec.field(), threshold, spec.type());
    }

    private Condition createInCondition(ConditionSpec spec, boolean negated) {
        validateField(spec);
        if (spec.values() == null || spec.values().isEmpty()) {
            throw new ConfigurationException(spec.type() + " condition requires a values list");
        }
        InCondition in = new InCondition(spec.field(), spec.values());
        return negated ? new NotCondition(in) : in;
    }

    private Condition createExistsCondition(ConditionSpec spec) {
        validateField(spec);
        return new ExistsCondition(spec.field());
    }

    private Condition createNotCondition(ConditionSpec spec) {
        List<Condition> nested = createNested(spec);
        if (nested.size() != 1) {
            throw new ConfigurationException("NOT condition must have exactly one nested condition");
        }
        return new NotCondition(nested.get(0));
    }

    private List<Condition> createNested(ConditionSpec spec) {
        if (spec.conditions() == null || spec.conditions().isEmpty()) {
            throw new ConfigurationException(spec.type() + " condition requires nested conditions");
        }
        List<Condition> conditions = new ArrayList<>();
        for (ConditionSpec nested : spec.conditions()) {
            conditions.add(create(nested));
        }
        return conditions;
    }

    // Validation helpers

    private void validateField(ConditionSpec spec) {
        if (spec.field() == null || spec.field().isBlank()) {
            throw new ConfigurationException(spec.type() + " condition requires a field");
        }
    }

    private void validateValue(ConditionSpec spec) {
        if (spec.value() == null) {
            throw new ConfigurationException(spec.type() + " condition requires a value");
        }
    }
}
