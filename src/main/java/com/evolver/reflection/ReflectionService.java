package com.evolver.reflection;

import com.evolver.engine.ExecutionReport;
import com.evolver.patch.PatchProposal;
import com.evolver.rule.RuleSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Combines trace-based reflection with the advisor, when one is configured.
 * Proposals are deduplicated by id, trace-based ones first.
 */
public class ReflectionService implements AutoCloseable {

    private final ReflectionV1 v1;
    private final ReflectionV2 v2;

    public ReflectionService(ReflectionV1 v1, ReflectionV2 v2) {
        this.v1 = v1;
        this.v2 = v2;
    }

    public static ReflectionService withoutAdvisor(ReflectionV1 v1) {
        return new ReflectionService(v1, null);
    }

    public boolean hasAdvisor() {
        return v2 != null;
    }

    public List<PatchProposal> reflect(List<ExecutionReport> reports, String versionId, RuleSet rules) {
        List<ExecutionReport> failed = new ArrayList<>();
        for (ExecutionReport report : reports) {
            if (!report.isSuccess()) {
                failed.add(report);
            }
        }
        if (failed.isEmpty()) {
            return List.of();
        }

        Map<String, PatchProposal> merged = new LinkedHashMap<>();
        for (PatchProposal proposal : v1.reflect(failed, rules)) {
            merged.putIfAbsent(proposal.id(), proposal);
        }
        Optional.ofNullable(v2).ifPresent(advisor -> {
            FailureContext context = new FailureContext(versionId, rules.rules(), failed);
            for (PatchProposal proposal : advisor.reflect(context, rules)) {
                merged.putIfAbsent(proposal.id(), proposal);
            }
        });
        return new ArrayList<>(merged.values());
    }

    @Override
    public void close() {
        if (v2 != null) {
            v2.close();
        }
    }
}
