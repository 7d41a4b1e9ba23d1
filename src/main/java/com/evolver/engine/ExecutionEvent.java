package com.evolver.engine;

import java.time.Instant;

/**
 * One state transition during a run. Node fields are null for run-level events.
 */
public record ExecutionEvent(Instant timestamp, EventType type, String nodeId, String action, String detail) {

    public static ExecutionEvent run(Instant timestamp, EventType type, String detail) {
        return new ExecutionEvent(timestamp, type, null, null, detail);
    }
}
