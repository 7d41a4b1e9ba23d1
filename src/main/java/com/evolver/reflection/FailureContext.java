package com.evolver.reflection;

import com.evolver.engine.ExecutionReport;
import com.evolver.rule.Rule;

import java.util.List;

/**
 * What an advisor gets to see: the failed runs of a cycle and the rules they were built from.
 *
 * @param versionId model version the runs used
 * @param rules     full rule definitions of that version
 * @param reports   non-successful reports
 */
public record FailureContext(String versionId, List<Rule> rules, List<ExecutionReport> reports) {

    public FailureContext {
        rules = List.copyOf(rules);
        reports = List.copyOf(reports);
    }

    public boolean isEmpty() {
        return reports.isEmpty();
    }
}
