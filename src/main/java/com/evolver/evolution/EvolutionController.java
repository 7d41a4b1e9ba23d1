package com.evolver.evolution;

import com.evolver.exception.BudgetExceededException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.simulation.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides which simulated proposals may be committed.
 *
 * <p>Admission runs in four steps: candidates that alone would break the budget are
 * rejected; the rest are reduced to their Pareto frontier; frontier members that regress
 * success or improve nothing are rejected; the remaining members are admitted in
 * {@link ParetoFrontier#ADMISSION_ORDER} while budget remains. Budget is only consumed
 * by {@link #recordCommit}, which the patch applier calls after a successful commit.
 */
public class EvolutionController {

    private static final Logger log = LoggerFactory.getLogger(EvolutionController.class);

    private final PatchBudget budget;
    private final RollingWindowCounter patches;
    private final RollingWindowCounter ruleGrowth;
    private final Map<String, SimulationResult> admitted = new LinkedHashMap<>();

    public EvolutionController(PatchBudget budget, Clock clock) {
        this.budget = budget;
        this.patches = new RollingWindowCounter(budget.windowMillis(), clock);
        this.ruleGrowth = new RollingWindowCounter(budget.windowMillis(), clock);
    }

    public PatchBudget getBudget() {
        return budget;
    }

    /**
     * Rank one batch. Replaces the admissions of the previous batch.
     */
    public synchronized EvolutionDecision decide(List<SimulationResult> results) {
        admitted.clear();
        List<Rejection> rejections = new ArrayList<>();
        List<SimulationResult> feasible = new ArrayList<>();

        for (SimulationResult result : results) {
            try {
                checkBudget(result, 0, 0);
                feasible.add(result);
            } catch (BudgetExceededException e) {
                rejections.add(new Rejection(result.proposalId(), RejectionReason.BUDGET_EXCEEDED, e.getMessage()));
            }
        }

        // Ranked over every feasible candidate so nothing admitted is dominated within the batch
        List<SimulationResult> ranked = ParetoFrontier.frontier(feasible);
        List<SimulationResult> frontier = new ArrayList<>();
        for (SimulationResult result : feasible) {
            if (result.diff().successRegresses()) {
                rejections.add(new Rejection(result.proposalId(), RejectionReason.NO_IMPROVEMENT,
                        "success rate drops by " + (-result.diff().successDelta())));
            } else if (!result.diff().improvesAnything()) {
                rejections.add(new Rejection(result.proposalId(), RejectionReason.NO_IMPROVEMENT,
                        "no metric improves"));
            } else if (!ranked.contains(result)) {
                rejections.add(new Rejection(result.proposalId(), RejectionReason.DOMINATED,
                        "dominated by another candidate"));
            }
        }
        for (SimulationResult result : ranked) {
            if (!result.diff().successRegresses() && result.diff().improvesAnything()) {
                frontier.add(result);
            }
        }

        List<SimulationResult> accepted = new ArrayList<>();
        int plannedPatches = 0;
        int plannedGrowth = 0;
        for (SimulationResult result : frontier) {
            try {
                checkBudget(result, plannedPatches, plannedGrowth);
            } catch (BudgetExceededException e) {
                rejections.add(new Rejection(result.proposalId(), RejectionReason.BUDGET_EXCEEDED, e.getMessage()));
                continue;
            }
            plannedPatches++;
            plannedGrowth += growth(result);
            accepted.add(result);
            admitted.put(result.proposalId(), result);
        }

        for (Rejection rejection : rejections) {
            log.warn("Rejected proposal {} ({}): {}", rejection.proposalId(), rejection.reason(), rejection.detail());
        }
        log.info("Evolution decision: {} candidates, {} accepted {}", results.size(), accepted.size(),
                accepted.stream().map(SimulationResult::proposalId).toList());
        return new EvolutionDecision(accepted, rejections);
    }

    /**
     * Re-check a candidate right before it is committed.
     *
     * @throws InvalidProposalException if it was not admitted by the last decision
     * @throws BudgetExceededException  if committing it now would exceed the budget
     */
    public synchronized void verifyAdmissible(SimulationResult result) {
        if (admitted.get(result.proposalId()) != result) {
            throw new InvalidProposalException(result.proposalId(), "not admitted by the evolution controller");
        }
        checkBudget(result, 0, 0);
    }

    /**
     * Charge a committed proposal to the budget.
     *
     * @param commitId unique id of the commit (the new version id)
     */
    public synchronized void recordCommit(SimulationResult result, String commitId) {
        admitted.remove(result.proposalId());
        String key = result.proposalId() + "@" + commitId;
        patches.tryAdd(key, 1);
        int growth = growth(result);
        if (growth > 0) {
            ruleGrowth.tryAdd(key, growth);
        }
    }

    public synchronized BudgetStatus budgetStatus() {
        int used = patches.count();
        int grown = ruleGrowth.total();
        return new BudgetStatus(used, Math.max(0, budget.maxPatchesPerWindow() - used),
                grown, Math.max(0, budget.maxRuleCountIncrease() - grown), budget.windowMillis());
    }

    /**
     * Start a new budget window now.
     */
    public synchronized void rollover() {
        patches.rollover();
        ruleGrowth.rollover();
        log.info("Patch budget window rolled over");
    }

    private void checkBudget(SimulationResult result, int extraPatches, int extraGrowth) {
        int used = patches.count() + extraPatches;
        if (used + 1 > budget.maxPatchesPerWindow()) {
            throw new BudgetExceededException(result.proposalId(),
                    used + " of " + budget.maxPatchesPerWindow() + " patches used in this window");
        }
        int grown = ruleGrowth.total() + extraGrowth;
        int growth = growth(result);
        if (grown + growth > budget.maxRuleCountIncrease()) {
            throw new BudgetExceededException(result.proposalId(),
                    "rule growth " + grown + " + " + growth + " exceeds " + budget.maxRuleCountIncrease());
        }
    }

    private static int growth(SimulationResult result) {
        return Math.max(0, result.diff().ruleCountDelta());
    }
}
