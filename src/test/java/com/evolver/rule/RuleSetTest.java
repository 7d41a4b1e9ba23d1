package com.evolver.rule;

import com.evolver.condition.ConditionSpec;
import com.evolver.exception.CyclicOrderConstraintException;
import com.evolver.exception.DuplicateRuleIdException;
import com.evolver.state.WorldState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RuleSet and rule invariants.
 */
class RuleSetTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000L);

    private RuleSet rules;

    @BeforeEach
    void setUp() {
        rules = new RuleSet();
    }

    @Test
    @DisplayName("Adding a rule with an existing id fails")
    void duplicateIdRejected() {
        rules.addRule(precondition("login", 0.5));
        assertThrows(DuplicateRuleIdException.class, () -> rules.addRule(precondition("login", 0.9)));
        assertEquals(1, rules.size());
    }

    @Test
    @DisplayName("Applicable rules are ACTIVE, hold their conditions and are ordered by confidence then id")
    void applicableRulesOrdering() {
        rules.addRule(precondition("b-rule", 0.7));
        rules.addRule(precondition("a-rule", 0.7));
        rules.addRule(precondition("high", 0.9));
        rules.addRule(precondition("search-only", 0.95).withCondition(ConditionSpec.equals("goal.kind", "search")));
        rules.addRule(precondition("cooling", 0.99)
                .withMetadata(new RuleMetadata(0, 0, 0.99, RuleStatus.COOLDOWN, NOW, 1)));

        List<Rule> applicable = rules.applicableRules(WorldState.of(Map.of("goal.kind", "browse")));

        assertEquals(List.of("high", "a-rule", "b-rule"), applicable.stream().map(Rule::id).toList());
    }

    @Test
    @DisplayName("Order constraints forming a cycle are reported with the cycle")
    void cyclicOrderConstraints() {
        rules.addRule(Rule.order("fill-after-open", "browser.fill", List.of("browser.open"), meta(0.5)));
        rules.addRule(Rule.order("click-after-fill", "browser.click", List.of("browser.fill"), meta(0.5)));
        rules.validate();

        rules.addRule(Rule.order("open-after-click", "browser.open", List.of("browser.click"), meta(0.5)));
        CyclicOrderConstraintException e = assertThrows(CyclicOrderConstraintException.class, rules::validate);
        assertTrue(e.getCycle().containsAll(List.of("browser.open", "browser.fill", "browser.click")));
    }

    @Test
    @DisplayName("Deprecated rules do not take part in cycle detection")
    void deprecatedRulesIgnoredByValidation() {
        rules.addRule(Rule.order("a", "x", List.of("y"), meta(0.5)));
        rules.addRule(Rule.order("b", "y", List.of("x"),
                new RuleMetadata(0, 0, 0.1, RuleStatus.DEPRECATED, NOW, 3)));

        assertDoesNotThrow(rules::validate);
        assertEquals(1, rules.liveCount());
    }

    @Test
    @DisplayName("Rule kinds enforce their payload")
    void ruleValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> Rule.precondition("empty", "browser.click", Map.of(), meta(0.5)));
        assertThrows(IllegalArgumentException.class,
                () -> Rule.order("none", "browser.click", List.of(), meta(0.5)));
        assertThrows(IllegalArgumentException.class,
                () -> Rule.order("self", "browser.click", List.of("browser.click"), meta(0.5)));
    }

    @Test
    @DisplayName("Lifecycle only moves forward")
    void lifecycleForwardOnly() {
        RuleMetadata active = meta(0.5);
        RuleMetadata cooldown = active.withStatus(RuleStatus.COOLDOWN, NOW);
        RuleMetadata deprecated = cooldown.withStatus(RuleStatus.DEPRECATED, NOW);

        assertEquals(RuleStatus.DEPRECATED, deprecated.status());
        assertEquals(RuleStatus.DEPRECATED, active.withStatus(RuleStatus.DEPRECATED, NOW).status());
        assertThrows(IllegalStateException.class, () -> deprecated.withStatus(RuleStatus.ACTIVE, NOW));
        assertThrows(IllegalStateException.class, () -> cooldown.withStatus(RuleStatus.ACTIVE, NOW));
    }

    @Test
    @DisplayName("Confidence is clamped to [0, 1]")
    void confidenceClamped() {
        assertEquals(1.0, meta(1.7).confidence());
        assertEquals(0.0, meta(0.5).withConfidence(-0.2, NOW).confidence());
    }

    @Test
    @DisplayName("Counts by status include every status")
    void countsByStatus() {
        rules.addRule(precondition("a", 0.5));
        rules.addRule(precondition("b", 0.5).withMetadata(meta(0.5).withStatus(RuleStatus.COOLDOWN, NOW)));

        Map<RuleStatus, Integer> counts = rules.countsByStatus();
        assertEquals(1, counts.get(RuleStatus.ACTIVE));
        assertEquals(1, counts.get(RuleStatus.COOLDOWN));
        assertEquals(0, counts.get(RuleStatus.DEPRECATED));
    }

    private static Rule precondition(String id, double confidence) {
        return Rule.precondition(id, "browser.click", Map.of("loggedIn", true), meta(confidence));
    }

    private static RuleMetadata meta(double confidence) {
        return RuleMetadata.initial(confidence, NOW);
    }
}
