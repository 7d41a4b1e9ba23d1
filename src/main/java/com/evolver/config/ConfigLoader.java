package com.evolver.config;

import com.evolver.capability.ScriptedEnvironment.ActionScript;
import com.evolver.condition.ConditionSpec;
import com.evolver.condition.ConditionType;
import com.evolver.condition.DefaultConditionEvaluator;
import com.evolver.dag.ActionCatalog;
import com.evolver.dag.ActionTemplate;
import com.evolver.evolution.PatchBudget;
import com.evolver.exception.ConfigurationException;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleKind;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleStatus;
import com.evolver.simulation.SimulationTask;
import com.evolver.simulation.TaskSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads Evolver configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static EvolverConfig load(String path) {
        log.info("Loading Evolver configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse configuration from YAML text.
     */
    public static EvolverConfig parse(String yaml) {
        return parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static EvolverConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // Settings may sit at the root or under an 'evolver' key
        Map<String, Object> config = root.containsKey("evolver")
                ? (Map<String, Object>) root.get("evolver")
                : root;

        try {
            String name = getString(config, "name", "evolver");
            EngineConfig engine = parseEngine(section(config, "engine"));
            PatchBudget budget = parseBudget(section(config, "budget"));
            LifecycleConfig lifecycle = parseLifecycle(section(config, "lifecycle"));
            SpecializationConfig specialization = parseSpecialization(section(config, "specialization"));
            ReflectionConfig reflection = parseReflection(section(config, "reflection"));
            AdvisorConfig advisor = parseAdvisor(section(config, "advisor"));
            int simulationParallelism = getInt(section(config, "simulation"), "parallelism", 4);

            List<Map<String, Object>> catalogList = (List<Map<String, Object>>) config.get("catalog");
            List<ActionTemplate> templates = new ArrayList<>();
            List<ActionScript> scripts = new ArrayList<>();
            parseCatalog(catalogList, templates, scripts);

            List<Rule> rules = parseRules((List<Map<String, Object>>) config.get("rules"), lifecycle.initialConfidence());
            TaskSet tasks = parseTasks((List<Map<String, Object>>) config.get("tasks"));

            EvolverConfig result = new EvolverConfig(name, engine, budget, lifecycle, specialization, reflection,
                    advisor, simulationParallelism, new ActionCatalog(templates), scripts, rules, tasks);

            log.info("Loaded Evolver configuration: {} with {} catalog actions, {} seed rules, {} tasks, budget {}/{}ms",
                    name, templates.size(), rules.size(), tasks.size(),
                    budget.maxPatchesPerWindow(), budget.windowMillis());
            return result;
        } catch (IllegalArgumentException | ClassCastException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static EngineConfig parseEngine(Map<String, Object> map) {
        EngineConfig defaults = EngineConfig.defaults();
        return new EngineConfig(
                getInt(map, "max-parallelism", defaults.maxParallelism()),
                getLong(map, "node-timeout-ms", defaults.nodeTimeoutMillis()),
                getString(map, "thread-name-prefix", defaults.threadNamePrefix()));
    }

    private static PatchBudget parseBudget(Map<String, Object> map) {
        PatchBudget defaults = PatchBudget.defaults();
        return new PatchBudget(
                getLong(map, "window-ms", defaults.windowMillis()),
                getInt(map, "max-patches-per-window", defaults.maxPatchesPerWindow()),
                getInt(map, "max-rule-count-increase", defaults.maxRuleCountIncrease()));
    }

    private static LifecycleConfig parseLifecycle(Map<String, Object> map) {
        LifecycleConfig defaults = LifecycleConfig.defaults();
        return new LifecycleConfig(
                getDouble(map, "initial-confidence", defaults.initialConfidence()),
                getDouble(map, "reward", defaults.reward()),
                getDouble(map, "penalty", defaults.penalty()),
                getDouble(map, "decay-rate", defaults.decayRate()),
                getDouble(map, "cooldown-threshold", defaults.cooldownThreshold()),
                getInt(map, "deprecate-after-cycles", defaults.deprecateAfterCycles()));
    }

    private static SpecializationConfig parseSpecialization(Map<String, Object> map) {
        SpecializationConfig defaults = SpecializationConfig.defaults();
        return new SpecializationConfig(
                getDouble(map, "condition-weight", defaults.conditionWeight()),
                getDouble(map, "order-weight", defaults.orderWeight()));
    }

    private static ReflectionConfig parseReflection(Map<String, Object> map) {
        ReflectionConfig defaults = ReflectionConfig.defaults();
        return new ReflectionConfig(
                getInt(map, "max-conditions-per-rule", defaults.maxConditionsPerRule()),
                getInt(map, "max-edits-per-proposal", defaults.maxEditsPerProposal()));
    }

    private static AdvisorConfig parseAdvisor(Map<String, Object> map) {
        AdvisorConfig defaults = AdvisorConfig.defaults();
        return new AdvisorConfig(
                getBoolean(map, "enabled", defaults.enabled()),
                getLong(map, "timeout-ms", defaults.timeoutMillis()));
    }

    /**
     * Each catalog entry yields an action template (what the planner knows) and a script
     * (how the scripted environment behaves).
     */
    @SuppressWarnings("unchecked")
    private static void parseCatalog(List<Map<String, Object>> list, List<ActionTemplate> templates,
                                     List<ActionScript> scripts) {
        if (list == null) {
            return;
        }
        for (Map<String, Object> item : list) {
            String name = getString(item, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Catalog entry without a name");
            }
            Map<String, Object> params = (Map<String, Object>) item.get("params");
            Map<String, Object> effects = (Map<String, Object>) item.get("effects");
            Map<String, Object> requires = (Map<String, Object>) item.get("requires");
            List<String> mustFollow = getStringList(item, "must-follow");
            long duration = getLong(item, "duration-ms", 0);

            templates.add(new ActionTemplate(name, params, effects));
            scripts.add(new ActionScript(name, requires, effects, mustFollow, duration));
            log.debug("Parsed catalog action: name={}, effects={}, requires={}", name, effects, requires);
        }
    }

    @SuppressWarnings("unchecked")
    private static List<Rule> parseRules(List<Map<String, Object>> list, double defaultConfidence) {
        if (list == null) {
            return List.of();
        }
        Instant now = Instant.now();
        List<Rule> rules = new ArrayList<>();
        for (Map<String, Object> item : list) {
            String id = getString(item, "id", null);
            RuleKind kind = RuleKind.valueOf(normalize(getString(item, "kind", "PRECONDITION")));
            String action = getString(item, "action", null);

            List<ConditionSpec> conditions = new ArrayList<>();
            List<Map<String, Object>> conditionList = (List<Map<String, Object>>) item.get("conditions");
            if (conditionList != null) {
                for (Map<String, Object> c : conditionList) {
                    ConditionSpec spec = parseCondition(c);
                    DefaultConditionEvaluator.INSTANCE.validate(spec);
                    conditions.add(spec);
                }
            }

            Map<String, Object> requires = (Map<String, Object>) item.get("requires");
            List<String> predecessors = getStringList(item, "predecessors");
            String description = getString(item, "description", "");
            double confidence = getDouble(item, "confidence", defaultConfidence);
            RuleStatus status = RuleStatus.valueOf(normalize(getString(item, "status", "ACTIVE")));

            RuleMetadata metadata = new RuleMetadata(0, 0, confidence, status, now, 0);
            rules.add(new Rule(id, kind, action, conditions, requires, predecessors, description, metadata));
            log.debug("Parsed rule: id={}, kind={}, action={}, conditions={}", id, kind, action, conditions.size());
        }
        return rules;
    }

    @SuppressWarnings("unchecked")
    private static TaskSet parseTasks(List<Map<String, Object>> list) {
        if (list == null) {
            return new TaskSet(List.of());
        }
        List<SimulationTask> tasks = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String id = getString(item, "id", "task-" + (i + 1));
            String goal = getString(item, "goal", null);
            Map<String, Object> state = (Map<String, Object>) item.get("state");
            tasks.add(new SimulationTask(id, goal, state));
        }
        return new TaskSet(tasks);
    }

    @SuppressWarnings("unchecked")
    private static ConditionSpec parseCondition(Map<String, Object> map) {
        if (map == null) {
            return ConditionSpec.alwaysTrue();
        }

        String typeStr = getString(map, "type", "ALWAYS_TRUE");
        ConditionType type = ConditionType.valueOf(normalize(typeStr));

        String field = getString(map, "field", null);
        Object value = map.get("value");
        List<Object> values = (List<Object>) map.get("values");

        List<ConditionSpec> nestedConditions = null;
        List<Map<String, Object>> conditionsList = (List<Map<String, Object>>) map.get("conditions");
        if (conditionsList != null) {
            nestedConditions = new ArrayList<>();
            for (Map<String, Object> c : conditionsList) {
                nestedConditions.add(parseCondition(c));
            }
        }

        return new ConditionSpec(type, field, value, values, nestedConditions);
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : new LinkedHashMap<>();
    }

    private static String normalize(String enumName) {
        return enumName.toUpperCase(Locale.ROOT).replace("-", "_");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return List.of();
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of(value.toString());
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        return Integer.parseInt(value.toString());
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    private static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        return Double.parseDouble(value.toString());
    }
}
