package com.evolver.reflection;

import com.evolver.condition.DefaultConditionEvaluator;
import com.evolver.exception.ConfigurationException;
import com.evolver.exception.InvalidProposalException;
import com.evolver.patch.EditKind;
import com.evolver.patch.PatchEdit;
import com.evolver.patch.PatchProposal;
import com.evolver.rule.RuleSet;

import java.util.EnumSet;
import java.util.Set;

/**
 * Checks externally generated proposals before they enter simulation.
 */
public class ProposalValidator {

    /**
     * Edits an advisor may use. New rules only come from trace-based reflection.
     */
    public static final Set<EditKind> ADVISOR_WHITELIST = EnumSet.of(
            EditKind.ADD_CONDITION, EditKind.ADD_ORDER_CONSTRAINT, EditKind.NARROW_SCOPE, EditKind.DEPRECATE_RULE);

    private final int maxEdits;

    public ProposalValidator(int maxEdits) {
        this.maxEdits = maxEdits;
    }

    /**
     * @throws InvalidProposalException on the first violation found
     */
    public void validate(PatchProposal proposal, RuleSet rules) {
        if (proposal == null) {
            throw new InvalidProposalException("<null>", "advisor returned a null proposal");
        }
        String id = proposal.id();
        if (proposal.edits().size() > maxEdits) {
            throw new InvalidProposalException(id, proposal.edits().size() + " edits exceed the limit of " + maxEdits);
        }
        for (PatchEdit edit : proposal.edits()) {
            if (edit == null) {
                throw new InvalidProposalException(id, "null edit");
            }
            if (!ADVISOR_WHITELIST.contains(edit.kind())) {
                throw new InvalidProposalException(id, "edit kind " + edit.kind() + " is not allowed");
            }
            if (!rules.contains(edit.ruleId())) {
                throw new InvalidProposalException(id, "unknown rule '" + edit.ruleId() + "'");
            }
            if (edit.condition() != null) {
                try {
                    DefaultConditionEvaluator.INSTANCE.validate(edit.condition());
                } catch (ConfigurationException e) {
                    throw new InvalidProposalException(id, "malformed condition: " + e.getMessage());
                }
            }
            for (String predecessor : edit.predecessors()) {
                if (predecessor == null || predecessor.isBlank()) {
                    throw new InvalidProposalException(id, "blank predecessor action");
                }
            }
        }
    }
}
