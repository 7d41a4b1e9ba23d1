package com.evolver.loop;

import com.evolver.evolution.BudgetStatus;
import com.evolver.lifecycle.RuleHealth;
import com.evolver.rule.Rule;

import java.util.List;

/**
 * Read-only view returned by {@link EvolutionLoop#inspect()}.
 */
public record SystemState(
        String currentVersion,
        List<String> lineage,
        int versionCount,
        List<Rule> rules,
        RuleHealth health,
        BudgetStatus budget,
        int auditRecords,
        int cyclesRun
) {
    public SystemState {
        lineage = List.copyOf(lineage);
        rules = List.copyOf(rules);
    }
}
