package com.evolver.config;

import com.evolver.capability.ScriptedEnvironment.ActionScript;
import com.evolver.dag.ActionCatalog;
import com.evolver.evolution.PatchBudget;
import com.evolver.rule.Rule;
import com.evolver.simulation.TaskSet;

import java.util.List;

/**
 * Root configuration.
 *
 * @param name                  instance name used in logs
 * @param engine                engine worker pool
 * @param budget                patch budget
 * @param lifecycle             rule confidence and lifecycle constants
 * @param specialization        specialization score weights
 * @param reflection            reflection limits
 * @param advisor               advisor settings
 * @param simulationParallelism proposals simulated at the same time
 * @param catalog               known actions and their effects
 * @param environment           scripted behavior of the catalog actions
 * @param rules                 seed rules of version v0
 * @param tasks                 fixed evaluation task set
 */
public record EvolverConfig(
        String name,
        EngineConfig engine,
        PatchBudget budget,
        LifecycleConfig lifecycle,
        SpecializationConfig specialization,
        ReflectionConfig reflection,
        AdvisorConfig advisor,
        int simulationParallelism,
        ActionCatalog catalog,
        List<ActionScript> environment,
        List<Rule> rules,
        TaskSet tasks
) {
    public EvolverConfig {
        if (simulationParallelism < 1) {
            throw new IllegalArgumentException("simulationParallelism must be at least 1");
        }
        environment = environment == null ? List.of() : List.copyOf(environment);
        rules = rules == null ? List.of() : List.copyOf(rules);
        tasks = tasks == null ? new TaskSet(List.of()) : tasks;
        catalog = catalog == null ? ActionCatalog.empty() : catalog;
    }

    /**
     * Defaults for everything, with the given catalog, seed rules and tasks.
     */
    public static EvolverConfig defaults(ActionCatalog catalog, List<Rule> rules, TaskSet tasks) {
        return new EvolverConfig("evolver", EngineConfig.defaults(), PatchBudget.defaults(),
                LifecycleConfig.defaults(), SpecializationConfig.defaults(), ReflectionConfig.defaults(),
                AdvisorConfig.defaults(), 4, catalog, List.of(), rules, tasks);
    }

    public EvolverConfig withBudget(PatchBudget newBudget) {
        return new EvolverConfig(name, engine, newBudget, lifecycle, specialization, reflection, advisor,
                simulationParallelism, catalog, environment, rules, tasks);
    }

    public EvolverConfig withLifecycle(LifecycleConfig newLifecycle) {
        return new EvolverConfig(name, engine, budget, newLifecycle, specialization, reflection, advisor,
                simulationParallelism, catalog, environment, rules, tasks);
    }
}
