package com.evolver.adapter.spring;

import com.evolver.capability.CapabilityProvider;
import com.evolver.capability.ScriptedEnvironment;
import com.evolver.config.ConfigLoader;
import com.evolver.config.EvolverConfig;
import com.evolver.loop.EvolutionLoop;
import com.evolver.reflection.Advisor;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for Evolver.
 */
@Configuration
@ConditionalOnProperty(prefix = "evolver", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(EvolverProperties.class)
public class EvolverAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EvolverAutoConfiguration.class);

    private EvolutionLoop evolutionLoop;

    @Bean
    @ConditionalOnMissingBean
    public EvolverConfig evolverConfig(EvolverProperties properties) {
        log.info("Loading Evolver configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock evolverClock() {
        return Clock.systemUTC();
    }

    /**
     * Scripted environment built from the catalog unless the application provides real capabilities.
     */
    @Bean
    @ConditionalOnMissingBean
    public CapabilityProvider capabilityProvider(EvolverConfig config) {
        log.info("No capability provider defined, using scripted environment with {} actions",
                config.environment().size());
        return new ScriptedEnvironment(config.environment());
    }

    @Bean
    @ConditionalOnMissingBean
    public EvolutionLoop evolutionLoop(EvolverConfig config, CapabilityProvider capabilityProvider,
                                       ObjectProvider<Advisor> advisor, Clock evolverClock) {
        log.info("Creating EvolutionLoop: {}", config.name());
        this.evolutionLoop = EvolutionLoop.create(config, capabilityProvider, advisor.getIfAvailable(), evolverClock);
        return this.evolutionLoop;
    }

    @PreDestroy
    public void shutdown() {
        if (evolutionLoop != null) {
            log.info("Shutting down EvolutionLoop");
            evolutionLoop.close();
        }
    }
}
