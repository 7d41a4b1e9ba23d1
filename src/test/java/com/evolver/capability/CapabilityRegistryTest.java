package com.evolver.capability;

import com.evolver.dag.Action;
import com.evolver.exception.ActionFailureException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRegistryTest {

    @Test
    @DisplayName("Longest matching prefix handles the action")
    void longestPrefixWins() {
        Capability browser = action -> Observation.of("browser", 1);
        Capability forms = action -> Observation.of("forms", 2);
        CapabilityRegistry registry = new CapabilityRegistry()
                .register("browser.", browser)
                .register("browser.fill", forms);

        assertEquals("forms", registry.execute(Action.of("browser.fill")).actionName());
        assertEquals("browser", registry.execute(Action.of("browser.open")).actionName());
        assertSame(browser, registry.resolve("browser.click"));
    }

    @Test
    @DisplayName("Unrouted actions fail with ERROR")
    void noRoute() {
        CapabilityRegistry registry = new CapabilityRegistry();

        ActionFailureException e = assertThrows(ActionFailureException.class,
                () -> registry.execute(Action.of("filesystem.write")));
        assertEquals(FailureKind.ERROR, e.getKind());
        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", registry));
    }
}
