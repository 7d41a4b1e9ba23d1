package com.evolver.evolution;

import com.evolver.exception.BudgetExceededException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.simulation.SimulationResult;
import com.evolver.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.evolver.evolution.ParetoFrontierTest.result;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for budgeted, Pareto-ranked admission of simulated proposals.
 */
class EvolutionControllerTest {

    private TestClock clock;

    @BeforeEach
    void setUp() {
        clock = TestClock.atEpochSecond(10_000);
    }

    // =====================================================================
    // Filtering
    // =====================================================================

    @Test
    @DisplayName("A zero patch budget rejects every candidate")
    void zeroBudgetRejectsAll() {
        EvolutionController controller = controller(0, 10);

        EvolutionDecision decision = controller.decide(List.of(result("p1", 0.5, 0), result("p2", 0.3, 0)));

        assertTrue(decision.accepted().isEmpty());
        assertEquals(2, decision.rejectedFor(RejectionReason.BUDGET_EXCEEDED).size());
    }

    @Test
    @DisplayName("Regressing or flat candidates are rejected as no improvement")
    void noImprovement() {
        EvolutionController controller = controller(5, 10);

        EvolutionDecision decision = controller.decide(List.of(
                result("flat", 0.0, 0),
                result("worse", -0.3, -1),
                result("better", 0.3, 0)));

        assertEquals(List.of("better"), decision.acceptedIds());
        assertEquals(List.of("flat", "worse"), decision.rejectedFor(RejectionReason.NO_IMPROVEMENT).stream()
                .map(Rejection::proposalId).toList());
    }

    @Test
    @DisplayName("Shrinking the rule set counts as an improvement")
    void fewerRulesImproves() {
        EvolutionController controller = controller(5, 10);

        assertEquals(List.of("prune"), controller.decide(List.of(result("prune", 0.0, -1))).acceptedIds());
    }

    @Test
    @DisplayName("Dominated candidates are rejected")
    void dominatedRejected() {
        EvolutionController controller = controller(5, 10);

        EvolutionDecision decision = controller.decide(List.of(result("strong", 0.5, 0), result("weak", 0.2, 1)));

        assertEquals(List.of("strong"), decision.acceptedIds());
        assertEquals("weak", decision.rejectedFor(RejectionReason.DOMINATED).get(0).proposalId());
    }

    @Test
    @DisplayName("More general rules count as an improvement and beat a candidate they dominate")
    void generalizationDominates() {
        EvolutionController controller = controller(5, 10);

        EvolutionDecision decision = controller.decide(List.of(
                result("general", 0.0, 0, -1.0, 0.0),
                result("steadier", 0.0, 0, 0.0, 0.1)));

        assertEquals(List.of("general"), decision.acceptedIds());
        assertEquals("steadier", decision.rejectedFor(RejectionReason.DOMINATED).get(0).proposalId());
    }

    @Test
    @DisplayName("A flat candidate still keeps the candidates it dominates out")
    void flatCandidateStillDominates() {
        EvolutionController controller = controller(5, 10);

        EvolutionDecision decision = controller.decide(List.of(
                result("flat", 0.0, 0, 0.0, 0.0),
                result("steadier-but-narrower", 0.0, 0, 0.5, 0.1)));

        assertTrue(decision.accepted().isEmpty());
        assertEquals("flat", decision.rejectedFor(RejectionReason.NO_IMPROVEMENT).get(0).proposalId());
        assertEquals("steadier-but-narrower", decision.rejectedFor(RejectionReason.DOMINATED).get(0).proposalId());
    }

    @Test
    @DisplayName("No accepted candidate is dominated by another candidate of the same batch")
    void acceptedNeverDominated() {
        EvolutionController controller = controller(10, 10);
        List<SimulationResult> batch = List.of(
                result("a", 0.3, 1, 0.5, 0.0),
                result("b", 0.3, 0, 1.0, 0.0),
                result("c", 0.0, 0, -0.5, 0.2),
                result("d", 0.0, 0, 0.0, 0.3),
                result("e", 0.3, 1, 0.0, 0.0),
                result("f", -0.1, -1, -1.0, 0.0),
                result("g", 0.0, 1, 0.0, 0.0));

        EvolutionDecision decision = controller.decide(batch);

        assertFalse(decision.accepted().isEmpty());
        for (SimulationResult accepted : decision.accepted()) {
            for (SimulationResult other : batch) {
                assertFalse(ParetoFrontier.dominates(other.diff(), accepted.diff()),
                        accepted.proposalId() + " is dominated by " + other.proposalId());
            }
        }
        assertEquals(batch.size(), decision.accepted().size() + decision.rejections().size());
    }

    @Test
    @DisplayName("A candidate whose rule growth alone breaks the budget is rejected")
    void ruleGrowthBudget() {
        EvolutionController controller = controller(5, 1);

        EvolutionDecision decision = controller.decide(List.of(result("grow-two", 0.5, 2), result("grow-one", 0.4, 1)));

        assertEquals(List.of("grow-one"), decision.acceptedIds());
        assertEquals("grow-two", decision.rejectedFor(RejectionReason.BUDGET_EXCEEDED).get(0).proposalId());
    }

    // =====================================================================
    // Admission order and budget
    // =====================================================================

    @Test
    @DisplayName("Frontier members are admitted in order until the budget runs out")
    void admitsInOrderUntilBudget() {
        EvolutionController controller = controller(1, 10);

        EvolutionDecision decision = controller.decide(List.of(result("second", 0.3, 0), result("first", 0.6, 1)));

        assertEquals(List.of("first"), decision.acceptedIds());
        assertEquals("second", decision.rejectedFor(RejectionReason.BUDGET_EXCEEDED).get(0).proposalId());
    }

    @Test
    @DisplayName("Committed patches consume the window budget until it rolls")
    void commitsConsumeBudget() {
        EvolutionController controller = controller(1, 10);
        SimulationResult first = result("first", 0.6, 1);
        controller.decide(List.of(first));
        controller.verifyAdmissible(first);
        controller.recordCommit(first, "v1");

        BudgetStatus status = controller.budgetStatus();
        assertEquals(1, status.patchesUsed());
        assertEquals(0, status.patchesRemaining());
        assertEquals(1, status.ruleGrowthUsed());

        assertTrue(controller.decide(List.of(result("next", 0.5, 0))).accepted().isEmpty());

        clock.advance(Duration.ofHours(1));
        assertEquals(List.of("next"), controller.decide(List.of(result("next", 0.5, 0))).acceptedIds());
    }

    @Test
    @DisplayName("Rollover frees the budget immediately")
    void rolloverFreesBudget() {
        EvolutionController controller = controller(1, 10);
        SimulationResult first = result("first", 0.6, 0);
        controller.decide(List.of(first));
        controller.recordCommit(first, "v1");

        controller.rollover();

        assertEquals(1, controller.budgetStatus().patchesRemaining());
    }

    // =====================================================================
    // Commit verification
    // =====================================================================

    @Test
    @DisplayName("Only candidates admitted by the last decision can be committed")
    void verifyRequiresAdmission() {
        EvolutionController controller = controller(5, 10);
        SimulationResult admitted = result("ok", 0.5, 0);
        controller.decide(List.of(admitted, result("flat", 0.0, 0)));

        assertDoesNotThrow(() -> controller.verifyAdmissible(admitted));
        assertThrows(InvalidProposalException.class, () -> controller.verifyAdmissible(result("ok", 0.5, 0)));
        assertThrows(InvalidProposalException.class, () -> controller.verifyAdmissible(result("flat", 0.0, 0)));

        controller.decide(List.of());
        assertThrows(InvalidProposalException.class, () -> controller.verifyAdmissible(admitted));
    }

    @Test
    @DisplayName("Verification rechecks the budget")
    void verifyRechecksBudget() {
        EvolutionController controller = controller(1, 10);
        SimulationResult a = result("a", 0.5, 0);
        controller.decide(List.of(a));
        // Another commit lands in between
        controller.recordCommit(result("other", 0.1, 0), "v1");

        assertThrows(BudgetExceededException.class, () -> controller.verifyAdmissible(a));
    }

    private EvolutionController controller(int maxPatches, int maxGrowth) {
        return new EvolutionController(new PatchBudget(3_600_000, maxPatches, maxGrowth), clock);
    }
}
