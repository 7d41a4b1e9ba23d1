package com.evolver.reflection;

import com.evolver.capability.FailureKind;
import com.evolver.condition.ConditionSpec;
import com.evolver.dag.ActionDAG;
import com.evolver.dag.NodeStatus;
import com.evolver.engine.ExecutionReport;
import com.evolver.engine.ExecutionStatus;
import com.evolver.engine.NodeResult;
import com.evolver.patch.PatchEdit;
import com.evolver.patch.PatchProposal;
import com.evolver.patch.ProposalSource;
import com.evolver.patch.Provenance;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Trace-based reflection.
 *
 * <p>For every FAILED or SKIPPED node of a non-successful run, the rules that built or
 * constrained it are blamed. A node without trace entries hands the blame to the nearest
 * predecessors that have some. Each blamed rule receives one proposal, chosen by the
 * failure signature:
 * <ul>
 *   <li>MISSING_PRECONDITION: ADD_CONDITION requiring the missing state</li>
 *   <li>ORDERING_VIOLATION on the rule's own action: ADD_ORDER_CONSTRAINT</li>
 *   <li>anything else: NARROW_SCOPE excluding the failing goal kind</li>
 * </ul>
 * A rule already at the condition limit is deprecated instead. A failure that no rule can
 * be blamed for, but whose signature names the missing state or predecessor, yields an
 * ADD_RULE proposal. Output depends only on the inputs.
 */
public class ReflectionV1 {

    private static final Logger log = LoggerFactory.getLogger(ReflectionV1.class);

    private final int maxConditionsPerRule;
    private final double initialConfidence;
    private final Clock clock;

    public ReflectionV1(int maxConditionsPerRule, double initialConfidence, Clock clock) {
        this.maxConditionsPerRule = maxConditionsPerRule;
        this.initialConfidence = initialConfidence;
        this.clock = clock;
    }

    public List<PatchProposal> reflect(ExecutionReport report, RuleSet rules) {
        return reflect(List.of(report), rules);
    }

    /**
     * Analyze all reports of one cycle. At most one proposal is made per blamed rule.
     */
    public List<PatchProposal> reflect(List<ExecutionReport> reports, RuleSet rules) {
        Map<String, PatchProposal> proposals = new LinkedHashMap<>();
        Set<String> blamedRules = new HashSet<>();
        for (ExecutionReport report : reports) {
            if (report.status() == ExecutionStatus.SUCCESS) {
                continue;
            }
            for (NodeResult result : report.results().values()) {
                if (result.status() != NodeStatus.FAILED && result.status() != NodeStatus.SKIPPED) {
                    continue;
                }
                NodeResult origin = result.status() == NodeStatus.FAILED ? result : failedAncestor(report, result.nodeId());
                Set<String> blamed = blame(report, result.nodeId(), rules);

                if (blamed.isEmpty()) {
                    if (result.status() == NodeStatus.FAILED) {
                        learnRule(report, result, rules).ifPresent(p -> proposals.putIfAbsent(p.id(), p));
                    }
                    continue;
                }
                for (String ruleId : blamed) {
                    if (blamedRules.add(ruleId)) {
                        PatchProposal proposal = fix(report, rules.find(ruleId).orElseThrow(), result, origin);
                        if (proposal != null) {
                            proposals.putIfAbsent(proposal.id(), proposal);
                        }
                    }
                }
            }
        }
        if (!proposals.isEmpty()) {
            log.debug("Reflection produced {} proposals: {}", proposals.size(), proposals.keySet());
        }
        return new ArrayList<>(proposals.values());
    }

    /**
     * Live rules recorded for the node, or for its nearest ancestors when it has none.
     */
    private Set<String> blame(ExecutionReport report, String nodeId, RuleSet rules) {
        ActionDAG dag = report.dag();
        Set<String> visited = new HashSet<>();
        Set<String> level = new TreeSet<>(dag::compareByPosition);
        level.add(nodeId);
        while (!level.isEmpty()) {
            Set<String> blamed = new LinkedHashSet<>();
            Set<String> next = new TreeSet<>(dag::compareByPosition);
            for (String id : level) {
                visited.add(id);
                for (String ruleId : report.trace().ruleIdsFor(id)) {
                    rules.find(ruleId)
                            .filter(r -> r.status() != RuleStatus.DEPRECATED)
                            .ifPresent(r -> blamed.add(r.id()));
                }
                for (String pred : dag.node(id).predecessors()) {
                    if (!visited.contains(pred)) {
                        next.add(pred);
                    }
                }
            }
            if (!blamed.isEmpty()) {
                return blamed;
            }
            level = next;
        }
        return Set.of();
    }

    private NodeResult failedAncestor(ExecutionReport report, String nodeId) {
        ActionDAG dag = report.dag();
        for (String id : dag.topologicalOrder()) {
            NodeResult candidate = report.result(id);
            if (candidate.status() == NodeStatus.FAILED && dag.descendants(id).contains(nodeId)) {
                return candidate;
            }
        }
        return report.result(nodeId);
    }

    private PatchProposal fix(ExecutionReport report, Rule rule, NodeResult node, NodeResult origin) {
        FailureKind kind = origin.failure().orElse(FailureKind.ERROR);
        Provenance provenance = provenance(report);
        String where = node.action() + " (" + node.nodeId() + ") " + node.status().name().toLowerCase();

        if (rule.conditionCount() >= maxConditionsPerRule) {
            return new PatchProposal("rv1-" + rule.id() + "-deprecate",
                    List.of(PatchEdit.deprecateRule(rule.id())), provenance,
                    "rule '" + rule.id() + "' keeps failing at " + rule.conditionCount() + " conditions; " + where);
        }

        if (kind == FailureKind.MISSING_PRECONDITION && origin.subject().isPresent()) {
            String key = origin.subject().get();
            ConditionSpec condition = origin.expected()
                    .map(v -> ConditionSpec.equals(key, v))
                    .orElseGet(() -> ConditionSpec.exists(key));
            if (!rule.conditions().contains(condition)) {
                return new PatchProposal("rv1-" + rule.id() + "-add-condition",
                        List.of(PatchEdit.addCondition(rule.id(), condition)), provenance,
                        "only apply '" + rule.id() + "' when " + condition + "; " + where);
            }
        }

        if (kind == FailureKind.ORDERING_VIOLATION && origin.subject().isPresent()
                && rule.action().equals(origin.action())) {
            String predecessor = origin.subject().get();
            if (!predecessor.equals(rule.action()) && !rule.predecessors().contains(predecessor)) {
                return new PatchProposal("rv1-" + rule.id() + "-add-order",
                        List.of(PatchEdit.addOrderConstraint(rule.id(), List.of(predecessor))), provenance,
                        "run " + rule.action() + " after " + predecessor + "; " + where);
            }
        }

        String goalKind = report.goal().kind().stateValue();
        ConditionSpec exclusion = ConditionSpec.notEquals(WorldState.GOAL_KIND, goalKind);
        if (rule.conditions().contains(exclusion)) {
            return null;
        }
        return new PatchProposal("rv1-" + rule.id() + "-narrow-" + goalKind,
                List.of(PatchEdit.narrowScope(rule.id(), exclusion)), provenance,
                "stop applying '" + rule.id() + "' to " + goalKind + " goals; " + where);
    }

    private Optional<PatchProposal> learnRule(ExecutionReport report, NodeResult failed, RuleSet rules) {
        if (failed.subject().isEmpty()) {
            return Optional.empty();
        }
        String subject = failed.subject().get();
        RuleMetadata metadata = RuleMetadata.initial(initialConfidence, clock.instant());
        Rule rule;
        String rationale;
        switch (failed.failure().orElse(FailureKind.ERROR)) {
            case MISSING_PRECONDITION -> {
                Object value = failed.expected().orElse(Boolean.TRUE);
                rule = Rule.precondition("learned-" + failed.action() + "-" + subject, failed.action(),
                                Map.of(subject, value), metadata)
                        .withDescription(failed.action() + " needs " + subject + "=" + value);
                rationale = failed.action() + " failed without " + subject + "=" + value;
            }
            case ORDERING_VIOLATION -> {
                if (subject.equals(failed.action())) {
                    return Optional.empty();
                }
                rule = Rule.order("learned-" + failed.action() + "-after-" + subject, failed.action(),
                                List.of(subject), metadata)
                        .withDescription(failed.action() + " runs after " + subject);
                rationale = failed.action() + " ran before " + subject;
            }
            default -> {
                return Optional.empty();
            }
        }
        if (rules.contains(rule.id())) {
            return Optional.empty();
        }
        return Optional.of(new PatchProposal("rv1-add-" + rule.id(), List.of(PatchEdit.addRule(rule)),
                provenance(report), rationale));
    }

    private static Provenance provenance(ExecutionReport report) {
        return new Provenance(ProposalSource.REFLECTION, report.taskId(), report.versionId());
    }
}
