package com.evolver.lifecycle;

import com.evolver.config.LifecycleConfig;
import com.evolver.dag.NodeStatus;
import com.evolver.engine.ExecutionReport;
import com.evolver.engine.NodeResult;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-cycle rule statistics and lifecycle transitions.
 *
 * <p>Rules that built or constrained nodes in the cycle's runs collect success and failure
 * counts and move their confidence by {@code reward} per succeeded node and
 * {@code penalty} per failed or skipped node. Unused ACTIVE and COOLDOWN rules decay by
 * {@code decayRate}. An ACTIVE rule below the threshold cools down; a COOLDOWN rule that
 * stays below it for {@code deprecateAfterCycles} cycles is deprecated. Deprecated rules
 * are left untouched and transitions never go backwards.
 */
public class RuleStatsUpdater {

    private static final Logger log = LoggerFactory.getLogger(RuleStatsUpdater.class);

    private final LifecycleConfig config;
    private final Clock clock;

    public RuleStatsUpdater(LifecycleConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @return updated rules in the same order; deprecated rules are returned as they are
     */
    public List<Rule> update(List<Rule> rules, List<ExecutionReport> reports) {
        Map<String, long[]> outcomes = outcomes(reports);
        Instant now = clock.instant();
        List<Rule> updated = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            updated.add(updateRule(rule, outcomes.get(rule.id()), now));
        }
        return updated;
    }

    public RuleHealth healthReport(List<Rule> rules) {
        RuleSet set = RuleSet.of(rules);
        double sum = 0;
        int live = 0;
        List<String> low = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.status() == RuleStatus.DEPRECATED) {
                continue;
            }
            live++;
            sum += rule.confidence();
            if (rule.confidence() < config.cooldownThreshold()) {
                low.add(rule.id());
            }
        }
        return new RuleHealth(set.countsByStatus(), live == 0 ? 0.0 : sum / live, low);
    }

    private Rule updateRule(Rule rule, long[] outcome, Instant now) {
        RuleStatus status = rule.status();
        if (status == RuleStatus.DEPRECATED) {
            return rule;
        }
        RuleMetadata metadata = rule.metadata();

        double confidence;
        if (outcome != null) {
            metadata = metadata.recordOutcomes(outcome[0], outcome[1], now);
            confidence = metadata.confidence() + config.reward() * outcome[0] - config.penalty() * outcome[1];
        } else {
            confidence = metadata.confidence() * (1.0 - config.decayRate());
        }
        metadata = metadata.withConfidence(confidence, now);

        boolean below = metadata.confidence() < config.cooldownThreshold();
        switch (status) {
            case ACTIVE -> {
                if (below) {
                    metadata = metadata.withStatus(RuleStatus.COOLDOWN, now).withBelowThresholdCycles(1, now);
                    log.info("Rule {} cooled down (confidence {})", rule.id(), format(metadata.confidence()));
                } else {
                    metadata = metadata.withBelowThresholdCycles(0, now);
                }
            }
            case COOLDOWN -> {
                if (below) {
                    int cycles = metadata.belowThresholdCycles() + 1;
                    metadata = metadata.withBelowThresholdCycles(cycles, now);
                    if (cycles >= config.deprecateAfterCycles()) {
                        metadata = metadata.withStatus(RuleStatus.DEPRECATED, now);
                        log.info("Rule {} deprecated after {} cycles below threshold", rule.id(), cycles);
                    }
                } else {
                    metadata = metadata.withBelowThresholdCycles(0, now);
                }
            }
            case DEPRECATED -> {
            }
        }
        return rule.withMetadata(metadata);
    }

    /**
     * ruleId -> {succeeded nodes, failed or skipped nodes} over all reports.
     */
    private static Map<String, long[]> outcomes(List<ExecutionReport> reports) {
        Map<String, long[]> outcomes = new HashMap<>();
        for (ExecutionReport report : reports) {
            for (NodeResult result : report.results().values()) {
                for (String ruleId : report.trace().ruleIdsFor(result.nodeId())) {
                    long[] counts = outcomes.computeIfAbsent(ruleId, k -> new long[2]);
                    if (result.status() == NodeStatus.SUCCEEDED) {
                        counts[0]++;
                    } else {
                        counts[1]++;
                    }
                }
            }
        }
        return outcomes;
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
