package com.evolver.config;

/**
 * Engine worker pool settings.
 *
 * @param maxParallelism    nodes of one run executing at the same time
 * @param nodeTimeoutMillis per-node timeout, a node exceeding it fails with TIMEOUT
 * @param threadNamePrefix  worker thread name prefix
 */
public record EngineConfig(int maxParallelism, long nodeTimeoutMillis, String threadNamePrefix) {

    public EngineConfig {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be at least 1");
        }
        if (nodeTimeoutMillis <= 0) {
            throw new IllegalArgumentException("nodeTimeoutMillis must be positive");
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            threadNamePrefix = "evolver-engine-";
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(4, 5000, "evolver-engine-");
    }

    public EngineConfig withMaxParallelism(int parallelism) {
        return new EngineConfig(parallelism, nodeTimeoutMillis, threadNamePrefix);
    }

    public EngineConfig withThreadNamePrefix(String prefix) {
        return new EngineConfig(maxParallelism, nodeTimeoutMillis, prefix);
    }
}
