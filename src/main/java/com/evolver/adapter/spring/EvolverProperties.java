package com.evolver.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Evolver.
 */
@ConfigurationProperties(prefix = "evolver")
public class EvolverProperties {

    /**
     * Whether Evolver is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Evolver configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:evolver.yaml";

    /**
     * Evolution steps the demo runner performs.
     */
    private int demoCycles = 3;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public int getDemoCycles() {
        return demoCycles;
    }

    public void setDemoCycles(int demoCycles) {
        this.demoCycles = demoCycles;
    }
}
