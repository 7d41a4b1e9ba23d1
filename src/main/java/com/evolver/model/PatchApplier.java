package com.evolver.model;

import com.evolver.evolution.EvolutionController;
import com.evolver.exception.CyclicOrderConstraintException;
import com.evolver.exception.DuplicateRuleIdException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.patch.PatchEditor;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.simulation.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * The only writer of the {@link WorldModel}.
 *
 * <p>Every commit is all-or-nothing: the candidate is re-checked with the controller, its
 * edits are applied to the current rules exactly once, the result is validated, and only
 * then is a new version published. Any failure leaves the model as it was.
 */
public class PatchApplier {

    private static final Logger log = LoggerFactory.getLogger(PatchApplier.class);

    private final WorldModel model;
    private final EvolutionController controller;
    private final PatchEditor editor;
    private final Clock clock;

    public PatchApplier(WorldModel model, EvolutionController controller, PatchEditor editor, Clock clock) {
        this.model = model;
        this.controller = controller;
        this.editor = editor;
        this.clock = clock;
    }

    /**
     * Commit an admitted proposal on top of the current version.
     *
     * @return the new current snapshot
     * @throws com.evolver.exception.BudgetExceededException if the budget no longer allows it
     * @throws InvalidProposalException                       if it was not admitted or its edits do not apply
     */
    public WorldModelSnapshot apply(SimulationResult candidate) {
        synchronized (model) {
            controller.verifyAdmissible(candidate);
            WorldModelSnapshot base = model.current();
            RuleSet next = editor.apply(base.rules(), candidate.proposal(), clock.instant());
            WorldModelSnapshot committed = model.advance(next.rules(), AuditKind.PATCH, candidate.proposal(),
                    candidate.diff(), candidate.proposal().rationale(), clock.instant());
            controller.recordCommit(candidate, committed.versionId());
            log.info("Committed proposal {} as {} (parent {}, {} rules)",
                    candidate.proposalId(), committed.versionId(), base.versionId(), committed.rules().size());
            return committed;
        }
    }

    /**
     * Commit lifecycle statistics as a version of its own.
     *
     * @return the new snapshot, or the current one when nothing changed
     */
    public WorldModelSnapshot commitMaintenance(List<Rule> rules, String reason) {
        synchronized (model) {
            WorldModelSnapshot base = model.current();
            if (base.rules().equals(rules)) {
                return base;
            }
            try {
                RuleSet.of(rules).validate();
            } catch (DuplicateRuleIdException | CyclicOrderConstraintException e) {
                throw new InvalidProposalException("maintenance", e.getMessage());
            }
            WorldModelSnapshot committed = model.advance(rules, AuditKind.MAINTENANCE, null, null, reason,
                    clock.instant());
            log.info("Committed rule maintenance as {} (parent {}): {}", committed.versionId(), base.versionId(), reason);
            return committed;
        }
    }

    /**
     * Point the model back at an earlier version. History is kept.
     *
     * @throws com.evolver.exception.UnknownVersionException if the version was never recorded
     */
    public WorldModelSnapshot rollback(String versionId) {
        synchronized (model) {
            String from = model.currentVersionId();
            WorldModelSnapshot target = model.repoint(versionId, "rollback from " + from, clock.instant());
            log.info("Rolled back from {} to {}", from, versionId);
            return target;
        }
    }
}
