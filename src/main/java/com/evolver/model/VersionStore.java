package com.evolver.model;

import com.evolver.exception.UnknownVersionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Arena of snapshots indexed by version id. Snapshots only reference their parent;
 * children are found through a separate index.
 */
final class VersionStore {

    private final Map<String, WorldModelSnapshot> versions = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, List<String>> children = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the id is taken or the parent is unknown
     */
    void put(WorldModelSnapshot snapshot) {
        if (versions.containsKey(snapshot.versionId())) {
            throw new IllegalStateException("Version " + snapshot.versionId() + " already exists");
        }
        if (snapshot.parentId() != null && !versions.containsKey(snapshot.parentId())) {
            throw new IllegalStateException("Parent " + snapshot.parentId() + " of "
                    + snapshot.versionId() + " is not recorded");
        }
        versions.put(snapshot.versionId(), snapshot);
        if (snapshot.parentId() != null) {
            children.computeIfAbsent(snapshot.parentId(), k -> Collections.synchronizedList(new ArrayList<>()))
                    .add(snapshot.versionId());
        }
    }

    WorldModelSnapshot get(String versionId) {
        WorldModelSnapshot snapshot = versionId == null ? null : versions.get(versionId);
        if (snapshot == null) {
            throw new UnknownVersionException(versionId);
        }
        return snapshot;
    }

    boolean contains(String versionId) {
        return versionId != null && versions.containsKey(versionId);
    }

    List<String> children(String versionId) {
        get(versionId);
        List<String> ids = children.get(versionId);
        if (ids == null) {
            return List.of();
        }
        synchronized (ids) {
            return List.copyOf(ids);
        }
    }

    /**
     * Version ids from {@code versionId} up to the root.
     */
    List<String> lineage(String versionId) {
        List<String> path = new ArrayList<>();
        WorldModelSnapshot current = get(versionId);
        while (current != null) {
            path.add(current.versionId());
            current = current.parentId() == null ? null : versions.get(current.parentId());
        }
        return path;
    }

    List<WorldModelSnapshot> all() {
        synchronized (versions) {
            return List.copyOf(versions.values());
        }
    }

    int size() {
        return versions.size();
    }
}
