package com.evolver.lifecycle;

import com.evolver.rule.RuleStatus;

import java.util.List;
import java.util.Map;

/**
 * Summary of the rule population.
 *
 * @param countsByStatus        rules per lifecycle status
 * @param averageConfidence     mean confidence of non-deprecated rules, 0 if none
 * @param lowConfidenceRuleIds  non-deprecated rules below the cooldown threshold
 */
public record RuleHealth(Map<RuleStatus, Integer> countsByStatus, double averageConfidence,
                         List<String> lowConfidenceRuleIds) {

    public RuleHealth {
        countsByStatus = Map.copyOf(countsByStatus);
        lowConfidenceRuleIds = List.copyOf(lowConfidenceRuleIds);
    }

    public int count(RuleStatus status) {
        return countsByStatus.getOrDefault(status, 0);
    }
}
