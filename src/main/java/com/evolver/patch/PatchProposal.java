package com.evolver.patch;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered set of edits proposed as one unit.
 */
public record PatchProposal(String id, List<PatchEdit> edits, Provenance provenance, String rationale) {

    public PatchProposal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Proposal id cannot be blank");
        }
        if (edits == null || edits.isEmpty()) {
            throw new IllegalArgumentException("Proposal '" + id + "' has no edits");
        }
        if (provenance == null) {
            throw new IllegalArgumentException("Proposal '" + id + "' has no provenance");
        }
        edits = List.copyOf(edits);
        rationale = rationale == null ? "" : rationale;
    }

    public Set<String> targetRuleIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (PatchEdit edit : edits) {
            ids.add(edit.ruleId());
        }
        return ids;
    }

    public boolean contains(EditKind kind) {
        return edits.stream().anyMatch(e -> e.kind() == kind);
    }
}
