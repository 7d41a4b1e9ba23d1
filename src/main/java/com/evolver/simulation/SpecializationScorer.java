package com.evolver.simulation;

import com.evolver.config.SpecializationConfig;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;

/**
 * How narrowly the active rules are scoped. Lower means more general.
 */
public class SpecializationScorer {

    private final SpecializationConfig config;

    public SpecializationScorer(SpecializationConfig config) {
        this.config = config;
    }

    public double score(RuleSet rules) {
        double score = 0;
        for (Rule rule : rules.rules()) {
            if (rule.status() == RuleStatus.ACTIVE) {
                score += config.conditionWeight() * rule.conditionCount()
                        + config.orderWeight() * rule.predecessors().size();
            }
        }
        return score;
    }
}
