package com.evolver.loop;

import com.evolver.capability.CapabilityProvider;
import com.evolver.config.EvolverConfig;
import com.evolver.dag.BuildResult;
import com.evolver.dag.DagBuilder;
import com.evolver.engine.Engine;
import com.evolver.engine.ExecutionReport;
import com.evolver.evolution.BudgetStatus;
import com.evolver.evolution.EvolutionController;
import com.evolver.evolution.EvolutionDecision;
import com.evolver.exception.BudgetExceededException;
import com.evolver.exception.EvolverException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.lifecycle.RuleStatsUpdater;
import com.evolver.model.ModelExporter;
import com.evolver.model.PatchApplier;
import com.evolver.model.WorldModel;
import com.evolver.model.WorldModelSnapshot;
import com.evolver.patch.PatchEditor;
import com.evolver.patch.PatchProposal;
import com.evolver.reflection.Advisor;
import com.evolver.reflection.ProposalValidator;
import com.evolver.reflection.ReflectionService;
import com.evolver.reflection.ReflectionV1;
import com.evolver.reflection.ReflectionV2;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.simulation.SimulationResult;
import com.evolver.simulation.SimulationTask;
import com.evolver.simulation.Simulator;
import com.evolver.simulation.SpecializationScorer;
import com.evolver.simulation.TaskSet;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns one instance of every component and sequences the control loop:
 * build, execute, reflect, simulate, decide, apply, update statistics.
 *
 * <p>{@link #runTask} may be called at any time and only reads the model. Evolution steps
 * are serialized, so cycles never overlap.
 */
public class EvolutionLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EvolutionLoop.class);

    private final WorldModel model;
    private final DagBuilder builder;
    private final Engine engine;
    private final CapabilityProvider capabilities;
    private final ReflectionService reflection;
    private final Simulator simulator;
    private final EvolutionController controller;
    private final PatchApplier applier;
    private final RuleStatsUpdater statsUpdater;
    private final ModelExporter exporter = new ModelExporter();
    private final TaskSet tasks;

    private final List<ExecutionReport> pending = new ArrayList<>();
    private final AtomicInteger taskCounter = new AtomicInteger(0);
    private final AtomicInteger cycles = new AtomicInteger(0);

    public EvolutionLoop(WorldModel model, DagBuilder builder, Engine engine, CapabilityProvider capabilities,
                         ReflectionService reflection, Simulator simulator, EvolutionController controller,
                         PatchApplier applier, RuleStatsUpdater statsUpdater, TaskSet tasks) {
        this.model = model;
        this.builder = builder;
        this.engine = engine;
        this.capabilities = capabilities;
        this.reflection = reflection;
        this.simulator = simulator;
        this.controller = controller;
        this.applier = applier;
        this.statsUpdater = statsUpdater;
        this.tasks = tasks;
    }

    /**
     * Wire a loop from configuration.
     *
     * @param advisor optional advisor, null for trace-based reflection only
     */
    public static EvolutionLoop create(EvolverConfig config, CapabilityProvider capabilities,
                                       Advisor advisor, Clock clock) {
        WorldModel model = WorldModel.create(config.rules(), clock.instant());
        DagBuilder builder = new DagBuilder(config.catalog());
        Engine engine = new Engine(config.engine(), clock);
        PatchEditor editor = new PatchEditor(config.lifecycle().initialConfidence());

        ReflectionV1 v1 = new ReflectionV1(config.reflection().maxConditionsPerRule(),
                config.lifecycle().initialConfidence(), clock);
        ReflectionService reflection;
        if (advisor != null && config.advisor().enabled()) {
            reflection = new ReflectionService(v1, new ReflectionV2(advisor,
                    new ProposalValidator(config.reflection().maxEditsPerProposal()), config.advisor().timeoutMillis()));
        } else {
            reflection = ReflectionService.withoutAdvisor(v1);
        }

        Simulator simulator = new Simulator(builder, config.engine(), capabilities,
                new SpecializationScorer(config.specialization()), editor, clock, config.simulationParallelism());
        EvolutionController controller = new EvolutionController(config.budget(), clock);
        PatchApplier applier = new PatchApplier(model, controller, editor, clock);
        RuleStatsUpdater statsUpdater = new RuleStatsUpdater(config.lifecycle(), clock);

        log.info("Evolution loop '{}' ready: {} seed rules, {} tasks, advisor {}",
                config.name(), config.rules().size(), config.tasks().size(),
                reflection.hasAdvisor() ? "enabled" : "disabled");
        return new EvolutionLoop(model, builder, engine, capabilities, reflection, simulator, controller,
                applier, statsUpdater, config.tasks());
    }

    /**
     * Build and execute one goal against the current version. The report is kept for the
     * next evolution step.
     *
     * @throws com.evolver.exception.UnsatisfiableGoalException      if no DAG can satisfy the goal
     * @throws com.evolver.exception.RuleConflictException           if applicable rules contradict each other
     * @throws com.evolver.exception.CyclicOrderConstraintException if the constraints form a cycle
     */
    public ExecutionReport runTask(String goal, WorldState state) {
        WorldModelSnapshot snapshot = model.current();
        String taskId = "task-" + taskCounter.incrementAndGet();
        BuildResult build = builder.build(goal, snapshot.ruleSet(), state);
        ExecutionReport report = engine.execute(taskId, build, snapshot.versionId(), state,
                capabilities.open(taskId, state));
        synchronized (pending) {
            pending.add(report);
        }
        log.info("Task {} '{}' on {}: {} ({} nodes)", taskId, goal, snapshot.versionId(),
                report.status(), report.results().size());
        return report;
    }

    /**
     * Run the task set on the current version, reflect on every report collected since the
     * last step, and commit what the controller accepts followed by rule statistics.
     */
    public synchronized CycleSummary evolveStep() {
        int cycle = cycles.incrementAndGet();
        WorldModelSnapshot base = model.current();
        RuleSet rules = base.ruleSet();

        List<ExecutionReport> reports = drainPending();
        int planningFailures = 0;
        for (SimulationTask task : tasks.tasks()) {
            String taskId = "cycle-" + cycle + "/" + task.id();
            WorldState state = task.state();
            try {
                BuildResult build = builder.build(task.goal(), rules, state);
                reports.add(engine.execute(taskId, build, base.versionId(), state, capabilities.open(taskId, state)));
            } catch (EvolverException e) {
                planningFailures++;
                log.warn("Cycle {}: task {} cannot be planned: {}", cycle, task.id(), e.getMessage());
            }
        }

        List<PatchProposal> proposals = reflection.reflect(reports, base.versionId(), rules);
        List<SimulationResult> results = simulator.simulateAll(base, proposals, tasks);
        EvolutionDecision decision = controller.decide(results);

        List<String> committed = new ArrayList<>();
        for (SimulationResult candidate : decision.accepted()) {
            try {
                applier.apply(candidate);
                committed.add(candidate.proposalId());
            } catch (InvalidProposalException | BudgetExceededException e) {
                log.warn("Cycle {}: could not commit {}: {}", cycle, candidate.proposalId(), e.getMessage());
            }
        }

        List<Rule> updated = statsUpdater.update(model.current().rules(), reports);
        WorldModelSnapshot after = applier.commitMaintenance(updated, "cycle " + cycle + " rule statistics");

        long successes = reports.stream().filter(ExecutionReport::isSuccess).count();
        double successRate = reports.isEmpty() ? 0.0 : (double) successes / reports.size();
        CycleSummary summary = new CycleSummary(cycle, base.versionId(), after.versionId(), reports.size(),
                successRate, planningFailures, proposals.stream().map(PatchProposal::id).toList(), committed,
                decision.rejections(), controller.budgetStatus());
        log.info("Cycle {} done: {} -> {}, {} reports ({} succeeded), {} proposals, committed {}",
                cycle, summary.versionBefore(), summary.versionAfter(), reports.size(), successes,
                proposals.size(), committed);
        return summary;
    }

    public SystemState inspect() {
        WorldModelSnapshot current = model.current();
        return new SystemState(current.versionId(), model.lineage(current.versionId()), model.versionCount(),
                current.rules(), statsUpdater.healthReport(current.rules()), controller.budgetStatus(),
                model.auditLog().size(), cycles.get());
    }

    /**
     * @throws com.evolver.exception.UnknownVersionException if the version was never recorded
     */
    public synchronized WorldModelSnapshot rollback(String versionId) {
        return applier.rollback(versionId);
    }

    public BudgetStatus budgetStatus() {
        return controller.budgetStatus();
    }

    public void rolloverBudget() {
        controller.rollover();
    }

    public String exportJson() {
        return exporter.toJson(model);
    }

    public void export(Path path) {
        exporter.write(model, path);
    }

    public WorldModel getModel() {
        return model;
    }

    private List<ExecutionReport> drainPending() {
        synchronized (pending) {
            List<ExecutionReport> drained = new ArrayList<>(pending);
            pending.clear();
            return drained;
        }
    }

    @Override
    public void close() {
        engine.close();
        simulator.close();
        reflection.close();
    }
}
