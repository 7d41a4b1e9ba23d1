package com.evolver.engine;

public enum EventType {
    RUN_STARTED,
    NODE_STARTED,
    NODE_SUCCEEDED,
    NODE_FAILED,
    NODE_SKIPPED,
    RUN_COMPLETED
}
