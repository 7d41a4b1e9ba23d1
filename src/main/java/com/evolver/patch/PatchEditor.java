package com.evolver.patch;

import com.evolver.exception.CyclicOrderConstraintException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Applies the edits of a proposal to a copy of a rule list, each exactly once.
 *
 * <p>The input is never modified. Any edit that cannot be applied, or a result whose
 * order constraints form a cycle, fails the whole proposal with
 * {@link InvalidProposalException}.
 */
public class PatchEditor {

    private static final Logger log = LoggerFactory.getLogger(PatchEditor.class);

    private final double initialConfidence;

    public PatchEditor(double initialConfidence) {
        this.initialConfidence = initialConfidence;
    }

    public RuleSet apply(List<Rule> base, PatchProposal proposal, Instant now) {
        RuleSet rules = RuleSet.of(base);
        for (PatchEdit edit : proposal.edits()) {
            applyEdit(rules, proposal.id(), edit, now);
        }
        try {
            rules.validate();
        } catch (CyclicOrderConstraintException e) {
            throw new InvalidProposalException(proposal.id(), "edits create cyclic order constraints " + e.getCycle());
        }
        log.debug("Applied proposal {} ({} edits)", proposal.id(), proposal.edits().size());
        return rules;
    }

    private void applyEdit(RuleSet rules, String proposalId, PatchEdit edit, Instant now) {
        if (edit.kind() == EditKind.ADD_RULE) {
            if (rules.contains(edit.ruleId())) {
                throw new InvalidProposalException(proposalId, "rule '" + edit.ruleId() + "' already exists");
            }
            rules.addRule(edit.rule().withMetadata(RuleMetadata.initial(initialConfidence, now)));
            return;
        }

        Rule target = rules.find(edit.ruleId())
                .orElseThrow(() -> new InvalidProposalException(proposalId, "unknown rule '" + edit.ruleId() + "'"));
        if (target.status() == RuleStatus.DEPRECATED) {
            throw new InvalidProposalException(proposalId, "rule '" + target.id() + "' is deprecated");
        }

        Rule edited = switch (edit.kind()) {
            case ADD_CONDITION, NARROW_SCOPE -> {
                if (target.conditions().contains(edit.condition())) {
                    throw new InvalidProposalException(proposalId,
                            "rule '" + target.id() + "' already has condition " + edit.condition());
                }
                yield target.withCondition(edit.condition());
            }
            case ADD_ORDER_CONSTRAINT -> {
                List<String> fresh = new ArrayList<>(edit.predecessors());
                fresh.removeAll(target.predecessors());
                if (fresh.isEmpty()) {
                    throw new InvalidProposalException(proposalId,
                            "rule '" + target.id() + "' already orders after " + edit.predecessors());
                }
                if (fresh.contains(target.action())) {
                    throw new InvalidProposalException(proposalId,
                            "rule '" + target.id() + "' cannot order " + target.action() + " after itself");
                }
                yield target.withPredecessors(fresh);
            }
            case DEPRECATE_RULE -> target.withMetadata(target.metadata().withStatus(RuleStatus.DEPRECATED, now));
            case ADD_RULE -> throw new IllegalStateException("handled above");
        };
        if (edit.kind() != EditKind.DEPRECATE_RULE) {
            edited = edited.withMetadata(edited.metadata().withConfidence(edited.confidence(), now));
        }
        rules.replaceRule(edited);
    }
}
