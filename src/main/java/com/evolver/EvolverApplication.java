package com.evolver;

import com.evolver.adapter.spring.EvolverProperties;
import com.evolver.engine.ExecutionReport;
import com.evolver.exception.EvolverException;
import com.evolver.loop.CycleSummary;
import com.evolver.loop.EvolutionLoop;
import com.evolver.loop.SystemState;
import com.evolver.spring.EnableEvolver;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Example Spring Boot application running the control loop against the scripted environment.
 */
@SpringBootApplication
@EnableEvolver
public class EvolverApplication {

    private static final Logger log = LoggerFactory.getLogger(EvolverApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EvolverApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(EvolutionLoop loop, EvolverProperties properties) {
        return args -> {
            log.info("=== Evolver Demo Started ===");

            String goal = args.length > 0 ? String.join(" ", args) : "search for evolutionary algorithms";
            try {
                ExecutionReport report = loop.runTask(goal, WorldState.empty());
                log.info("Initial run of '{}': {}", goal, report.status());
            } catch (EvolverException e) {
                log.warn("Initial run of '{}' could not be planned: {}", goal, e.getMessage());
            }

            for (int i = 0; i < properties.getDemoCycles(); i++) {
                CycleSummary summary = loop.evolveStep();
                log.info("Cycle {}: success {} on {} -> {}, committed {}, rejected {}",
                        summary.cycle(), summary.successRate(), summary.versionBefore(), summary.versionAfter(),
                        summary.committedIds(), summary.rejections().size());
            }

            SystemState state = loop.inspect();
            log.info("Current version {} (lineage {}), {} rules, health {}",
                    state.currentVersion(), state.lineage(), state.rules().size(), state.health());
            log.info("Budget: {}", state.budget());
            log.debug("Model export:\n{}", loop.exportJson());

            log.info("=== Evolver Demo Completed ===");
        };
    }
}
