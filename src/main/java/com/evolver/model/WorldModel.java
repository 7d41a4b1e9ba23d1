package com.evolver.model;

import com.evolver.patch.PatchProposal;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.simulation.WorldModelDiff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Versioned aggregate of rules.
 *
 * <p>Versions are never deleted. Readers may call any public method at any time; the only
 * mutations ({@link #advance} and {@link #repoint}) are package-private and used by
 * {@link PatchApplier}. Snapshot, audit record and current pointer are published under
 * one lock.
 */
public class WorldModel {

    private static final Logger log = LoggerFactory.getLogger(WorldModel.class);

    private final VersionStore store = new VersionStore();
    private final List<AuditRecord> audit = new CopyOnWriteArrayList<>();
    private volatile String currentId;
    private long nextVersion;

    private WorldModel() {
    }

    /**
     * Create a model whose root version {@code v0} holds {@code seedRules}.
     *
     * @throws com.evolver.exception.DuplicateRuleIdException        if two seed rules share an id
     * @throws com.evolver.exception.CyclicOrderConstraintException if seed order constraints form a cycle
     */
    public static WorldModel create(List<Rule> seedRules, Instant now) {
        RuleSet.of(seedRules).validate();
        WorldModel model = new WorldModel();
        WorldModelSnapshot root = new WorldModelSnapshot("v0", null, seedRules, now);
        model.store.put(root);
        model.audit.add(new AuditRecord(AuditKind.INIT, "v0", null, null, null,
                seedRules.size() + " seed rules", now));
        model.currentId = "v0";
        model.nextVersion = 1;
        log.info("World model initialized at v0 with {} rules", seedRules.size());
        return model;
    }

    /**
     * Rebuild a model from exported state.
     */
    static WorldModel restore(List<WorldModelSnapshot> snapshots, String currentId, List<AuditRecord> auditLog) {
        WorldModel model = new WorldModel();
        long next = 0;
        for (WorldModelSnapshot snapshot : snapshots) {
            model.store.put(snapshot);
            next = Math.max(next, versionNumber(snapshot.versionId()) + 1);
        }
        model.store.get(currentId);
        model.audit.addAll(auditLog);
        model.currentId = currentId;
        model.nextVersion = next;
        return model;
    }

    public WorldModelSnapshot current() {
        return store.get(currentId);
    }

    public String currentVersionId() {
        return currentId;
    }

    /**
     * @throws com.evolver.exception.UnknownVersionException if the version was never recorded
     */
    public WorldModelSnapshot snapshot(String versionId) {
        return store.get(versionId);
    }

    public boolean hasVersion(String versionId) {
        return store.contains(versionId);
    }

    public List<WorldModelSnapshot> versions() {
        return store.all();
    }

    public int versionCount() {
        return store.size();
    }

    public List<String> children(String versionId) {
        return store.children(versionId);
    }

    /**
     * Version ids from {@code versionId} back to the root.
     */
    public List<String> lineage(String versionId) {
        return store.lineage(versionId);
    }

    public List<AuditRecord> auditLog() {
        return List.copyOf(audit);
    }

    synchronized WorldModelSnapshot advance(List<Rule> rules, AuditKind kind, PatchProposal proposal,
                                            WorldModelDiff diff, String note, Instant now) {
        String parent = currentId;
        WorldModelSnapshot next = new WorldModelSnapshot("v" + nextVersion, parent, rules, now);
        store.put(next);
        nextVersion++;
        audit.add(new AuditRecord(kind, next.versionId(), parent, proposal, diff, note, now));
        currentId = next.versionId();
        return next;
    }

    synchronized WorldModelSnapshot repoint(String versionId, String note, Instant now) {
        WorldModelSnapshot target = store.get(versionId);
        String previous = currentId;
        audit.add(new AuditRecord(AuditKind.ROLLBACK, versionId, previous, null, null, note, now));
        currentId = versionId;
        return target;
    }

    private static long versionNumber(String versionId) {
        try {
            return Long.parseLong(versionId.substring(1));
        } catch (NumberFormatException | IndexOutOfBoundsException e) {
            return 0;
        }
    }
}
