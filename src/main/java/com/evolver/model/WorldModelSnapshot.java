package com.evolver.model;

import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable version of the world model.
 *
 * @param versionId version id ({@code v0}, {@code v1}, ...)
 * @param parentId  version this one was derived from, null for the root
 * @param rules     full rule definitions in order
 * @param createdAt creation time
 */
public record WorldModelSnapshot(String versionId, String parentId, List<Rule> rules, Instant createdAt) {

    public WorldModelSnapshot {
        if (versionId == null || versionId.isBlank()) {
            throw new IllegalArgumentException("Version id cannot be blank");
        }
        if (versionId.equals(parentId)) {
            throw new IllegalArgumentException("Version " + versionId + " cannot be its own parent");
        }
        rules = List.copyOf(rules);
    }

    public Optional<String> parent() {
        return Optional.ofNullable(parentId);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /**
     * Fresh working copy of the rules; changes to it never affect the snapshot.
     */
    public RuleSet ruleSet() {
        return RuleSet.of(rules);
    }
}
