package com.evolver.simulation;

import com.evolver.condition.ConditionSpec;
import com.evolver.config.EngineConfig;
import com.evolver.config.SpecializationConfig;
import com.evolver.dag.DagBuilder;
import com.evolver.model.WorldModel;
import com.evolver.model.WorldModelSnapshot;
import com.evolver.patch.PatchEdit;
import com.evolver.patch.PatchEditor;
import com.evolver.patch.PatchProposal;
import com.evolver.patch.ProposalSource;
import com.evolver.patch.Provenance;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.support.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for A/B simulation of proposals against the scripted world.
 */
class SimulatorTest {

    private static final TaskSet TASKS = TaskSet.of(
            SimulationTask.of("browse-home", "browse to https://example.com"),
            SimulationTask.of("search-topic", "search for evolutionary algorithms"),
            SimulationTask.of("extract-data", "extract from https://example.com/data"));

    private Simulator simulator;
    private WorldModel model;

    @BeforeEach
    void setUp() {
        simulator = new Simulator(new DagBuilder(Fixtures.catalog()), EngineConfig.defaults(),
                Fixtures.environment(), new SpecializationScorer(SpecializationConfig.defaults()),
                new PatchEditor(0.5), Clock.fixed(Fixtures.NOW, ZoneOffset.UTC), 2);
        model = WorldModel.create(List.of(Fixtures.captchaRule()), Fixtures.NOW);
    }

    @AfterEach
    void tearDown() {
        simulator.close();
    }

    @Test
    @DisplayName("Baseline metrics reflect the failing captcha rule")
    void baselineMetrics() {
        SimulationMetrics metrics = simulator.evaluate(model.current().ruleSet(), "v0", TASKS);

        assertEquals(0.0, metrics.successRate());
        assertEquals(0.0, metrics.meanExecutionMillis());
        assertEquals(1, metrics.ruleCount());
        assertEquals(0.0, metrics.specializationScore());
        assertEquals(0.0, metrics.stability());
    }

    @Test
    @DisplayName("Same rules and tasks give the same metrics")
    void reproducible() {
        SimulationMetrics first = simulator.evaluate(model.current().ruleSet(), "v0", TASKS);
        SimulationMetrics second = simulator.evaluate(model.current().ruleSet(), "v0", TASKS);

        assertEquals(first, second);
    }

    @Test
    @DisplayName("Scoping the captcha rule to humans fixes browsing and extraction")
    void simulateImprovement() {
        SimulationResult result = simulator.simulate(model.current(), humanOnly(), TASKS);

        assertEquals("v0", result.baseVersionId());
        assertEquals(2.0 / 3, result.patched().successRate(), 1e-9);
        assertEquals(2.0 / 3, result.diff().successDelta(), 1e-9);
        assertEquals(0, result.diff().ruleCountDelta());
        assertEquals(1.0, result.diff().specializationDelta(), 1e-9);
        assertEquals(460.0 / 3, result.patched().meanExecutionMillis(), 1e-9);
        assertEquals(5.0 / 6, result.patched().stability(), 1e-9);
        assertTrue(result.diff().improvesAnything());
    }

    @Test
    @DisplayName("Simulation never touches the world model")
    void modelUntouched() {
        WorldModelSnapshot before = model.current();

        SimulationResult result = simulator.simulate(before, humanOnly(), TASKS);

        assertSame(before, model.current());
        assertEquals(1, model.versionCount());
        assertTrue(before.rules().get(0).conditions().isEmpty());
        assertEquals(1, result.patchedRules().get(0).conditions().size());
    }

    @Test
    @DisplayName("Batch simulation keeps input order and drops proposals that cannot apply")
    void batchDropsInvalid() {
        PatchProposal broken = new PatchProposal("broken", List.of(PatchEdit.deprecateRule("no-such-rule")),
                new Provenance(ProposalSource.ADVISOR, null, "v0"), "bad");
        PatchProposal deprecate = new PatchProposal("deprecate",
                List.of(PatchEdit.deprecateRule("captcha-before-open")),
                new Provenance(ProposalSource.REFLECTION, "task-1", "v0"), "drop it");

        List<SimulationResult> results = simulator.simulateAll(model.current(),
                List.of(humanOnly(), broken, deprecate), TASKS);

        assertEquals(List.of("human-only", "deprecate"), results.stream().map(SimulationResult::proposalId).toList());
        assertEquals(-1, results.get(1).diff().ruleCountDelta());
        assertTrue(simulator.simulateAll(model.current(), List.of(), TASKS).isEmpty());
    }

    @Test
    @DisplayName("Tasks that cannot be planned count as failures")
    void unplannableTasksFail() {
        TaskSet tasks = TaskSet.of(SimulationTask.of("bad", "search for cats"));
        RuleSet rules = model.current().ruleSet();
        rules.addRule(Rule.precondition("needs-vip", "browser.click", Map.of("vip", true), Fixtures.meta(0.5)));

        SimulationMetrics metrics = simulator.evaluate(rules, "v0", tasks);

        assertEquals(0.0, metrics.successRate());
        assertEquals(0.0, metrics.stability());
    }

    private static PatchProposal humanOnly() {
        return new PatchProposal("human-only",
                List.of(PatchEdit.addCondition("captcha-before-open", ConditionSpec.equals("human", true))),
                new Provenance(ProposalSource.REFLECTION, "task-1", "v0"), "captcha only for humans");
    }
}
