package com.evolver.capability;

import com.evolver.capability.ScriptedEnvironment.ActionScript;
import com.evolver.capability.ScriptedEnvironment.Session;
import com.evolver.dag.Action;
import com.evolver.exception.ActionFailureException;
import com.evolver.state.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScriptedEnvironmentTest {

    private ScriptedEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new ScriptedEnvironment(List.of(
                new ActionScript("browser.open", Map.of(), Map.of("page.loaded", true), List.of(), 100),
                new ActionScript("browser.login", Map.of(), Map.of("loggedIn", true), List.of(), 50),
                new ActionScript("browser.fill", Map.of("loggedIn", true), Map.of("form.filled", true),
                        List.of("browser.open"), 40)));
    }

    @Test
    @DisplayName("Successful actions apply their effects to the session")
    void appliesEffects() {
        Session session = environment.open("t1", WorldState.empty());

        Observation observation = session.execute(Action.of("browser.open"));

        assertEquals(100, observation.durationMillis());
        assertEquals(Map.of("page.loaded", true), observation.payload());
        assertTrue(session.currentState().satisfies("page.loaded", true));
    }

    @Test
    @DisplayName("Running before a required action is an ordering violation")
    void orderingViolation() {
        Session session = environment.open("t1", WorldState.of(Map.of("loggedIn", true)));

        ActionFailureException e = assertThrows(ActionFailureException.class,
                () -> session.execute(Action.of("browser.fill")));
        assertEquals(FailureKind.ORDERING_VIOLATION, e.getKind());
        assertEquals("browser.open", e.getSubject().orElseThrow());
    }

    @Test
    @DisplayName("Missing state is a missing precondition naming key and value")
    void missingPrecondition() {
        Session session = environment.open("t1", WorldState.empty());
        session.execute(Action.of("browser.open"));

        ActionFailureException e = assertThrows(ActionFailureException.class,
                () -> session.execute(Action.of("browser.fill")));
        assertEquals(FailureKind.MISSING_PRECONDITION, e.getKind());
        assertEquals("loggedIn", e.getSubject().orElseThrow());
        assertEquals(true, e.getExpected().orElseThrow());

        session.execute(Action.of("browser.login"));
        assertDoesNotThrow(() -> session.execute(Action.of("browser.fill")));
    }

    @Test
    @DisplayName("Sessions do not share state")
    void sessionsIsolated() {
        Session first = environment.open("t1", WorldState.empty());
        Session second = environment.open("t2", WorldState.empty());

        first.execute(Action.of("browser.login"));

        assertTrue(first.currentState().contains("loggedIn"));
        assertFalse(second.currentState().contains("loggedIn"));
    }

    @Test
    @DisplayName("Unknown actions fail with ERROR")
    void unknownAction() {
        ActionFailureException e = assertThrows(ActionFailureException.class,
                () -> environment.open("t1", WorldState.empty()).execute(Action.of("mail.send")));
        assertEquals(FailureKind.ERROR, e.getKind());
    }
}
