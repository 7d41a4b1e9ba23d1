package com.evolver.adapter.spring;

import com.evolver.capability.CapabilityProvider;
import com.evolver.capability.ScriptedEnvironment;
import com.evolver.config.EvolverConfig;
import com.evolver.engine.ExecutionStatus;
import com.evolver.exception.ConfigurationException;
import com.evolver.loop.EvolutionLoop;
import com.evolver.reflection.Advisor;
import com.evolver.state.WorldState;
import com.evolver.support.Fixtures;
import com.evolver.support.TestClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.DefaultListableBeanFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Bean methods of the auto-configuration, called the way the container would.
 */
class EvolverAutoConfigurationTest {

    private EvolverAutoConfiguration configuration;
    private EvolverProperties properties;

    @BeforeEach
    void setUp() {
        configuration = new EvolverAutoConfiguration();
        properties = new EvolverProperties();
    }

    @AfterEach
    void tearDown() {
        configuration.shutdown();
    }

    @Test
    @DisplayName("Properties default to the bundled configuration")
    void propertyDefaults() {
        assertTrue(properties.isEnabled());
        assertEquals("classpath:evolver.yaml", properties.getConfigPath());
        assertEquals(3, properties.getDemoCycles());
    }

    @Test
    @DisplayName("Beans wire a working loop without an advisor")
    void wiresLoop() {
        EvolverConfig config = configuration.evolverConfig(properties);
        CapabilityProvider provider = configuration.capabilityProvider(config);
        Clock clock = new TestClock(Fixtures.NOW);
        DefaultListableBeanFactory factory = new DefaultListableBeanFactory();

        EvolutionLoop loop = configuration.evolutionLoop(config, provider, factory.getBeanProvider(Advisor.class), clock);

        assertEquals("demo-evolver", config.name());
        assertInstanceOf(ScriptedEnvironment.class, provider);
        assertEquals("v0", loop.inspect().currentVersion());
        assertEquals(ExecutionStatus.SUCCESS,
                loop.runTask("browse to https://example.com", WorldState.of(Map.of("human", true))).status());
    }

    @Test
    @DisplayName("A registered advisor is picked up")
    void usesAdvisorBean() {
        EvolverConfig config = configuration.evolverConfig(properties);
        DefaultListableBeanFactory factory = new DefaultListableBeanFactory();
        Advisor advisor = context -> List.of();
        factory.registerSingleton("advisor", advisor);

        EvolutionLoop loop = configuration.evolutionLoop(config, configuration.capabilityProvider(config),
                factory.getBeanProvider(Advisor.class), configuration.evolverClock());

        assertEquals(1, loop.evolveStep().cycle());
    }

    @Test
    @DisplayName("A missing configuration file fails fast")
    void missingConfigFails() {
        properties.setConfigPath("classpath:does-not-exist.yaml");

        assertThrows(ConfigurationException.class, () -> configuration.evolverConfig(properties));
    }

    @Test
    @DisplayName("Shutdown without a loop is a no-op")
    void shutdownWithoutLoop() {
        assertDoesNotThrow(() -> new EvolverAutoConfiguration().shutdown());
    }
}
