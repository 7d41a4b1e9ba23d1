package com.evolver.config;

/**
 * External advisor settings.
 *
 * @param enabled       whether advisor proposals are requested at all
 * @param timeoutMillis how long to wait for the advisor before giving up on this cycle
 */
public record AdvisorConfig(boolean enabled, long timeoutMillis) {

    public AdvisorConfig {
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("Advisor timeout must be positive");
        }
    }

    public static AdvisorConfig defaults() {
        return new AdvisorConfig(true, 2000);
    }
}
