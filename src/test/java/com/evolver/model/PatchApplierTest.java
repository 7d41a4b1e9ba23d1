package com.evolver.model;

import com.evolver.condition.ConditionSpec;
import com.evolver.evolution.EvolutionController;
import com.evolver.evolution.EvolutionDecision;
import com.evolver.evolution.PatchBudget;
import com.evolver.exception.DuplicateRuleIdException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.exception.UnknownVersionException;
import com.evolver.patch.PatchEdit;
import com.evolver.patch.PatchEditor;
import com.evolver.patch.PatchProposal;
import com.evolver.patch.ProposalSource;
import com.evolver.patch.Provenance;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleStatus;
import com.evolver.simulation.SimulationMetrics;
import com.evolver.simulation.SimulationResult;
import com.evolver.simulation.WorldModelDiff;
import com.evolver.support.Fixtures;
import com.evolver.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for committing, maintaining and rolling back world model versions.
 */
class PatchApplierTest {

    private TestClock clock;
    private WorldModel model;
    private EvolutionController controller;
    private PatchApplier applier;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Fixtures.NOW);
        model = WorldModel.create(List.of(Fixtures.captchaRule()), Fixtures.NOW);
        controller = new EvolutionController(new PatchBudget(3_600_000, 5, 10), clock);
        applier = new PatchApplier(model, controller, new PatchEditor(0.5), clock);
    }

    @Test
    @DisplayName("An admitted proposal becomes a new version with an audit record")
    void commitAdmitted() {
        SimulationResult candidate = admit(proposal("human-only",
                PatchEdit.addCondition("captcha-before-open", ConditionSpec.equals("human", true))));
        clock.advance(Duration.ofMinutes(1));

        WorldModelSnapshot committed = applier.apply(candidate);

        assertEquals("v1", committed.versionId());
        assertEquals("v0", committed.parentId());
        assertEquals("v1", model.currentVersionId());
        assertEquals(1, model.current().rules().get(0).conditions().size());
        assertTrue(model.snapshot("v0").rules().get(0).conditions().isEmpty());
        assertEquals(1, controller.budgetStatus().patchesUsed());

        AuditRecord last = model.auditLog().get(model.auditLog().size() - 1);
        assertEquals(AuditKind.PATCH, last.kind());
        assertEquals("v0", last.fromVersion());
        assertEquals("human-only", last.proposalOpt().orElseThrow().id());
        assertEquals(candidate.diff(), last.diff());
        assertEquals(Fixtures.NOW.plusSeconds(60), last.timestamp());
    }

    @Test
    @DisplayName("A proposal the controller did not admit is refused without changes")
    void refusesUnadmitted() {
        SimulationResult candidate = result(proposal("sneaky", PatchEdit.deprecateRule("captcha-before-open")));

        assertThrows(InvalidProposalException.class, () -> applier.apply(candidate));

        assertEquals("v0", model.currentVersionId());
        assertEquals(1, model.versionCount());
        assertEquals(1, model.auditLog().size());
    }

    @Test
    @DisplayName("An edit that no longer applies leaves the model unchanged")
    void atomicOnFailedEdit() {
        SimulationResult first = result(proposal("narrow",
                PatchEdit.narrowScope("captcha-before-open", ConditionSpec.exists("human"))));
        SimulationResult second = result(proposal("narrow-again",
                PatchEdit.narrowScope("captcha-before-open", ConditionSpec.exists("human"))));
        EvolutionDecision decision = controller.decide(List.of(first, second));
        assertEquals(2, decision.accepted().size());

        applier.apply(decision.accepted().get(0));
        assertThrows(InvalidProposalException.class, () -> applier.apply(decision.accepted().get(1)));

        assertEquals("v1", model.currentVersionId());
        assertEquals(2, model.versionCount());
        assertEquals(1, controller.budgetStatus().patchesUsed());
    }

    @Test
    @DisplayName("Rolling back to an unknown version fails and keeps the current pointer")
    void rollbackUnknown() {
        applier.apply(admit(proposal("deprecate", PatchEdit.deprecateRule("captcha-before-open"))));

        UnknownVersionException e = assertThrows(UnknownVersionException.class, () -> applier.rollback("v42"));

        assertEquals("v42", e.getVersionId());
        assertEquals("v1", model.currentVersionId());
    }

    @Test
    @DisplayName("Rollback repoints the model and later commits branch from there")
    void rollbackAndBranch() {
        applier.apply(admit(proposal("deprecate", PatchEdit.deprecateRule("captcha-before-open"))));
        assertEquals(RuleStatus.DEPRECATED, model.current().rules().get(0).status());

        WorldModelSnapshot restored = applier.rollback("v0");

        assertEquals("v0", restored.versionId());
        assertEquals("v0", model.currentVersionId());
        assertEquals(RuleStatus.ACTIVE, model.current().rules().get(0).status());
        assertEquals(AuditKind.ROLLBACK, model.auditLog().get(model.auditLog().size() - 1).kind());

        WorldModelSnapshot branch = applier.apply(admit(proposal("human-only",
                PatchEdit.addCondition("captcha-before-open", ConditionSpec.equals("human", true)))));

        assertEquals("v2", branch.versionId());
        assertEquals("v0", branch.parentId());
        assertEquals(List.of("v1", "v2"), model.children("v0"));
        assertEquals(List.of("v2", "v0"), model.lineage("v2"));
        assertTrue(model.hasVersion("v1"));
    }

    @Test
    @DisplayName("Lineage never revisits a version")
    void lineageAcyclic() {
        for (int i = 0; i < 3; i++) {
            applier.apply(admit(proposal("p" + i,
                    PatchEdit.addCondition("captcha-before-open", ConditionSpec.exists("k" + i)))));
        }

        for (WorldModelSnapshot snapshot : model.versions()) {
            List<String> lineage = model.lineage(snapshot.versionId());
            Set<String> unique = new HashSet<>(lineage);
            assertEquals(lineage.size(), unique.size());
            assertEquals("v0", lineage.get(lineage.size() - 1));
        }
    }

    @Test
    @DisplayName("Maintenance commits only when the rules changed")
    void maintenance() {
        WorldModelSnapshot unchanged = applier.commitMaintenance(model.current().rules(), "nothing to do");
        assertEquals("v0", unchanged.versionId());

        Rule rule = model.current().rules().get(0);
        Rule cooled = rule.withMetadata(rule.metadata().withConfidence(0.2, Fixtures.NOW));
        WorldModelSnapshot maintained = applier.commitMaintenance(List.of(cooled), "statistics update");

        assertEquals("v1", maintained.versionId());
        assertEquals(0.2, model.current().rules().get(0).confidence());
        AuditRecord last = model.auditLog().get(model.auditLog().size() - 1);
        assertEquals(AuditKind.MAINTENANCE, last.kind());
        assertTrue(last.proposalOpt().isEmpty());
        assertEquals(0, controller.budgetStatus().patchesUsed());
    }

    @Test
    @DisplayName("Creating a model with duplicate seed rule ids fails")
    void invalidSeed() {
        assertThrows(DuplicateRuleIdException.class,
                () -> WorldModel.create(List.of(Fixtures.captchaRule(), Fixtures.captchaRule()), Fixtures.NOW));
    }

    private SimulationResult admit(PatchProposal proposal) {
        SimulationResult result = result(proposal);
        assertEquals(List.of(proposal.id()), controller.decide(List.of(result)).acceptedIds());
        return result;
    }

    private static SimulationResult result(PatchProposal proposal) {
        SimulationMetrics baseline = new SimulationMetrics(0.0, 0.0, 1, 0.0, 0.0);
        SimulationMetrics patched = new SimulationMetrics(0.5, 100.0, 1, 1.0, 0.5);
        return new SimulationResult(proposal, "v0", baseline, patched, WorldModelDiff.between(baseline, patched),
                List.of());
    }

    private static PatchProposal proposal(String id, PatchEdit edit) {
        return new PatchProposal(id, List.of(edit), new Provenance(ProposalSource.REFLECTION, "task-1", "v0"),
                "test " + id);
    }
}
