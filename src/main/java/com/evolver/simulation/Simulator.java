package com.evolver.simulation;

import com.evolver.capability.CapabilityProvider;
import com.evolver.config.EngineConfig;
import com.evolver.dag.BuildResult;
import com.evolver.dag.DagBuilder;
import com.evolver.engine.Engine;
import com.evolver.engine.ExecutionReport;
import com.evolver.exception.EvolverException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.model.WorldModelSnapshot;
import com.evolver.patch.PatchEditor;
import com.evolver.patch.PatchProposal;
import com.evolver.rule.RuleSet;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A/B harness: runs the fixed task set against a snapshot's rules and against a fork
 * with a proposal applied, and compares the metrics.
 *
 * <p>Forks are never recorded in the world model. Each task runs its nodes one at a time
 * in node order against a fresh capability session, so the same rules and tasks always
 * produce the same metrics. Proposals of one batch are simulated in parallel.
 */
public class Simulator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    private final DagBuilder builder;
    private final Engine engine;
    private final CapabilityProvider capabilities;
    private final SpecializationScorer scorer;
    private final PatchEditor editor;
    private final Clock clock;
    private final ExecutorService batchExecutor;

    public Simulator(DagBuilder builder, EngineConfig engineConfig, CapabilityProvider capabilities,
                     SpecializationScorer scorer, PatchEditor editor, Clock clock, int batchParallelism) {
        this.builder = builder;
        this.capabilities = capabilities;
        this.scorer = scorer;
        this.editor = editor;
        this.clock = clock;
        this.engine = new Engine(engineConfig.withMaxParallelism(1).withThreadNamePrefix("evolver-sim-"),
                clock, batchParallelism);
        AtomicInteger counter = new AtomicInteger(0);
        this.batchExecutor = Executors.newFixedThreadPool(batchParallelism, r -> {
            Thread thread = new Thread(r, "evolver-batch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Metrics of running {@code tasks} against {@code rules}.
     */
    public SimulationMetrics evaluate(RuleSet rules, String label, TaskSet tasks) {
        int successes = 0;
        long totalMillis = 0;
        int executed = 0;
        int succeededNodes = 0;
        for (SimulationTask task : tasks.tasks()) {
            WorldState state = task.state();
            BuildResult build;
            try {
                build = builder.build(task.goal(), rules, state);
            } catch (EvolverException e) {
                log.debug("[{}] task {} cannot be planned: {}", label, task.id(), e.getMessage());
                continue;
            }
            String taskId = label + "/" + task.id();
            ExecutionReport report = engine.execute(taskId, build, label, state, capabilities.open(taskId, state));
            if (report.isSuccess()) {
                successes++;
            }
            totalMillis += report.totalDurationMillis();
            executed += report.executedCount();
            succeededNodes += report.succeededCount();
        }
        int taskCount = tasks.size();
        return new SimulationMetrics(
                taskCount == 0 ? 0.0 : (double) successes / taskCount,
                taskCount == 0 ? 0.0 : (double) totalMillis / taskCount,
                rules.liveCount(),
                scorer.score(rules),
                executed == 0 ? 0.0 : (double) succeededNodes / executed);
    }

    /**
     * Simulate one proposal against {@code base}.
     *
     * @throws InvalidProposalException if the proposal cannot be applied to the base rules
     */
    public SimulationResult simulate(WorldModelSnapshot base, PatchProposal proposal, TaskSet tasks) {
        SimulationMetrics baseline = evaluate(base.ruleSet(), base.versionId(), tasks);
        return simulateAgainst(base, baseline, proposal, tasks);
    }

    /**
     * Simulate a batch in parallel. Returns once every proposal finished, in input order;
     * proposals that cannot be applied are dropped.
     */
    public List<SimulationResult> simulateAll(WorldModelSnapshot base, List<PatchProposal> proposals, TaskSet tasks) {
        if (proposals.isEmpty()) {
            return List.of();
        }
        SimulationMetrics baseline = evaluate(base.ruleSet(), base.versionId(), tasks);

        List<CompletableFuture<SimulationResult>> futures = new ArrayList<>();
        for (PatchProposal proposal : proposals) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                try {
                    return simulateAgainst(base, baseline, proposal, tasks);
                } catch (InvalidProposalException e) {
                    log.warn("Dropping proposal {}: {}", proposal.id(), e.getMessage());
                    return null;
                }
            }, batchExecutor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            throw new EvolverException("Simulation batch failed", e.getCause() != null ? e.getCause() : e);
        }

        List<SimulationResult> results = new ArrayList<>();
        for (CompletableFuture<SimulationResult> future : futures) {
            SimulationResult result = future.join();
            if (result != null) {
                results.add(result);
            }
        }
        log.info("Simulated {} proposals against {} ({} tasks), {} usable",
                proposals.size(), base.versionId(), tasks.size(), results.size());
        return results;
    }

    private SimulationResult simulateAgainst(WorldModelSnapshot base, SimulationMetrics baseline,
                                             PatchProposal proposal, TaskSet tasks) {
        RuleSet fork = editor.apply(base.rules(), proposal, clock.instant());
        SimulationMetrics patched = evaluate(fork, base.versionId() + "+" + proposal.id(), tasks);
        WorldModelDiff diff = WorldModelDiff.between(baseline, patched);
        log.debug("Proposal {}: {}", proposal.id(), diff);
        return new SimulationResult(proposal, base.versionId(), baseline, patched, diff, fork.rules());
    }

    @Override
    public void close() {
        batchExecutor.shutdownNow();
        engine.close();
    }
}
