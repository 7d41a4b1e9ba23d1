package com.evolver.capability;

import com.evolver.dag.Action;
import com.evolver.exception.ActionFailureException;
import com.evolver.state.WorldState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Deterministic in-memory world.
 *
 * <p>Each scripted action declares the state it needs, the state it sets and the actions
 * that must have completed before it. Violations surface as {@link ActionFailureException}s
 * with the matching failure signature, which is what reflection learns from. Every task gets
 * its own {@link Session} seeded with the task's initial state.
 */
public class ScriptedEnvironment implements CapabilityProvider {

    private static final Logger log = LoggerFactory.getLogger(ScriptedEnvironment.class);

    private final Map<String, ActionScript> scripts;

    public ScriptedEnvironment(Collection<ActionScript> scripts) {
        Map<String, ActionScript> byName = new TreeMap<>();
        for (ActionScript script : scripts) {
            byName.put(script.name(), script);
        }
        this.scripts = Collections.unmodifiableMap(byName);
    }

    @Override
    public Session open(String taskId, WorldState initialState) {
        return new Session(taskId, initialState);
    }

    public Map<String, ActionScript> scripts() {
        return scripts;
    }

    /**
     * Behavior of one action.
     *
     * @param name           action name
     * @param requires       state that must hold before the action
     * @param effects        state set when the action succeeds
     * @param mustFollow     actions that must already have completed in this task
     * @param durationMillis duration reported on success
     */
    public record ActionScript(String name, Map<String, Object> requires, Map<String, Object> effects,
                               List<String> mustFollow, long durationMillis) {
        public ActionScript {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Scripted action name cannot be blank");
            }
            requires = requires == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(requires));
            effects = effects == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(effects));
            mustFollow = mustFollow == null ? List.of() : List.copyOf(mustFollow);
        }

        public static ActionScript simple(String name, long durationMillis) {
            return new ActionScript(name, Map.of(), Map.of(), List.of(), durationMillis);
        }
    }

    /**
     * Per-task view of the environment.
     */
    public final class Session implements Capability {

        private final String taskId;
        private final Map<String, Object> state;
        private final Set<String> completed = new HashSet<>();

        private Session(String taskId, WorldState initialState) {
            this.taskId = taskId;
            this.state = new LinkedHashMap<>(initialState.asMap());
        }

        @Override
        public synchronized Observation execute(Action action) {
            ActionScript script = scripts.get(action.name());
            if (script == null) {
                throw new ActionFailureException(FailureKind.ERROR, "Unknown action " + action.name());
            }
            for (String predecessor : script.mustFollow()) {
                if (!completed.contains(predecessor)) {
                    log.debug("[{}] {} ran before {}", taskId, action.name(), predecessor);
                    throw ActionFailureException.orderingViolation(action.name(), predecessor);
                }
            }
            for (Map.Entry<String, Object> required : script.requires().entrySet()) {
                Object actual = state.get(required.getKey());
                if (actual == null || !WorldState.sameValue(actual, required.getValue())) {
                    log.debug("[{}] {} is missing {}={}", taskId, action.name(),
                            required.getKey(), required.getValue());
                    throw ActionFailureException.missingPrecondition(action.name(),
                            required.getKey(), required.getValue());
                }
            }
            state.putAll(script.effects());
            completed.add(action.name());
            return new Observation(action.name(), script.effects(), script.durationMillis());
        }

        public synchronized WorldState currentState() {
            return WorldState.of(state);
        }
    }
}
