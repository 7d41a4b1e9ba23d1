package com.evolver.support;

import com.evolver.capability.ScriptedEnvironment;
import com.evolver.capability.ScriptedEnvironment.ActionScript;
import com.evolver.config.EngineConfig;
import com.evolver.dag.ActionCatalog;
import com.evolver.dag.ActionTemplate;
import com.evolver.dag.BuildResult;
import com.evolver.dag.DagBuilder;
import com.evolver.engine.Engine;
import com.evolver.engine.ExecutionReport;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleSet;
import com.evolver.state.WorldState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scripted browser world shared by tests: same actions, effects and requirements as the
 * bundled demo configuration.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static List<ActionScript> scripts() {
        return List.of(
                new ActionScript("browser.open", Map.of(), Map.of("page.loaded", true), List.of(), 120),
                new ActionScript("browser.login", Map.of(), Map.of("loggedIn", true), List.of(), 200),
                new ActionScript("browser.solve-captcha", Map.of("human", true), Map.of("captcha.solved", true),
                        List.of(), 400),
                new ActionScript("browser.fill", Map.of("loggedIn", true), Map.of("form.filled", true),
                        List.of("browser.open"), 40),
                new ActionScript("browser.click", Map.of(), Map.of("clicked", true), List.of("browser.fill"), 30),
                new ActionScript("browser.extract", Map.of("page.loaded", true), Map.of("data.extracted", true),
                        List.of(), 80),
                new ActionScript("filesystem.write", Map.of(), Map.of("file.written", true),
                        List.of("browser.extract"), 20),
                ActionScript.simple("generic.execute", 10));
    }

    public static ActionCatalog catalog() {
        List<ActionTemplate> templates = new ArrayList<>();
        for (ActionScript script : scripts()) {
            templates.add(new ActionTemplate(script.name(), Map.of(), script.effects()));
        }
        return new ActionCatalog(templates);
    }

    public static ScriptedEnvironment environment() {
        return new ScriptedEnvironment(scripts());
    }

    public static RuleMetadata meta(double confidence) {
        return RuleMetadata.initial(confidence, NOW);
    }

    /**
     * Captcha requirement on every page open; fails unless a human is present.
     */
    public static Rule captchaRule() {
        return Rule.precondition("captcha-before-open", "browser.open", Map.of("captcha.solved", true), meta(0.6));
    }

    /**
     * Build and run {@code goal} once against a fresh scripted session.
     */
    public static ExecutionReport run(String taskId, String goal, RuleSet rules, WorldState state) {
        return run(taskId, goal, rules, state, environment());
    }

    public static ExecutionReport run(String taskId, String goal, RuleSet rules, WorldState state,
                                      ScriptedEnvironment environment) {
        BuildResult build = new DagBuilder(catalog()).build(goal, rules, state);
        try (Engine engine = new Engine(EngineConfig.defaults())) {
            return engine.execute(taskId, build, "v0", state, environment.open(taskId, state));
        }
    }

    /**
     * The demo world with one action replaced (or removed when {@code replacement} is null).
     */
    public static ScriptedEnvironment environmentWith(String name, ActionScript replacement) {
        List<ActionScript> scripts = new ArrayList<>();
        for (ActionScript script : scripts()) {
            if (!script.name().equals(name)) {
                scripts.add(script);
            }
        }
        if (replacement != null) {
            scripts.add(replacement);
        }
        return new ScriptedEnvironment(scripts);
    }

    public static ExecutionReport run(String goal, RuleSet rules) {
        return run("task-1", goal, rules, WorldState.empty());
    }
}
