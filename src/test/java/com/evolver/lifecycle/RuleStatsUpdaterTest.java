package com.evolver.lifecycle;

import com.evolver.config.LifecycleConfig;
import com.evolver.engine.ExecutionReport;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleMetadata;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;
import com.evolver.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.evolver.support.Fixtures.meta;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for confidence updates and lifecycle transitions.
 */
class RuleStatsUpdaterTest {

    private RuleStatsUpdater updater;

    @BeforeEach
    void setUp() {
        updater = new RuleStatsUpdater(LifecycleConfig.defaults(), Clock.fixed(Fixtures.NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Failed and skipped nodes built by a rule lower its confidence")
    void failuresPenalize() {
        Rule captcha = Fixtures.captchaRule();
        ExecutionReport report = Fixtures.run("browse to https://example.com", RuleSet.of(List.of(captcha)));

        Rule updated = updater.update(List.of(captcha), List.of(report)).get(0);

        assertEquals(0.4, updated.confidence(), 1e-9);
        assertEquals(0, updated.metadata().successCount());
        assertEquals(2, updated.metadata().failureCount());
        assertEquals(RuleStatus.ACTIVE, updated.status());
    }

    @Test
    @DisplayName("Succeeded nodes built by a rule raise its confidence")
    void successesReward() {
        Rule login = Rule.precondition("login-before-fill", "browser.fill", Map.of("loggedIn", true), meta(0.5));
        ExecutionReport report = Fixtures.run("search for cats", RuleSet.of(List.of(login)));
        assertTrue(report.isSuccess());

        Rule updated = updater.update(List.of(login), List.of(report)).get(0);

        assertEquals(0.6, updated.confidence(), 1e-9);
        assertEquals(2, updated.metadata().successCount());
    }

    @Test
    @DisplayName("Unused rules decay")
    void unusedRulesDecay() {
        Rule idle = Fixtures.captchaRule();

        Rule updated = updater.update(List.of(idle), List.of()).get(0);

        assertEquals(0.54, updated.confidence(), 1e-9);
        assertEquals(Fixtures.NOW, updated.metadata().lastUpdated());
    }

    @Test
    @DisplayName("Rules below threshold cool down and are deprecated after staying there")
    void cooldownThenDeprecate() {
        List<Rule> rules = List.of(Fixtures.captchaRule().withMetadata(meta(0.32)));

        rules = updater.update(rules, List.of());
        assertEquals(RuleStatus.COOLDOWN, rules.get(0).status());
        assertEquals(1, rules.get(0).metadata().belowThresholdCycles());

        rules = updater.update(rules, List.of());
        assertEquals(RuleStatus.COOLDOWN, rules.get(0).status());
        assertEquals(2, rules.get(0).metadata().belowThresholdCycles());

        rules = updater.update(rules, List.of());
        assertEquals(RuleStatus.DEPRECATED, rules.get(0).status());

        Rule deprecated = rules.get(0);
        assertSame(deprecated, updater.update(rules, List.of()).get(0));
    }

    @Test
    @DisplayName("A cooling rule back above threshold resets its counter but stays in cooldown")
    void cooldownRecovery() {
        Rule cooling = Fixtures.captchaRule()
                .withMetadata(new RuleMetadata(0, 3, 0.5, RuleStatus.COOLDOWN, Fixtures.NOW, 2));

        Rule updated = updater.update(List.of(cooling), List.of()).get(0);

        assertEquals(RuleStatus.COOLDOWN, updated.status());
        assertEquals(0, updated.metadata().belowThresholdCycles());
    }

    @Test
    @DisplayName("Health report summarizes live rules")
    void healthReport() {
        List<Rule> rules = List.of(
                Fixtures.captchaRule(),
                Rule.order("a", "browser.fill", List.of("browser.open"), meta(0.2)),
                Rule.order("b", "browser.click", List.of("browser.fill"),
                        new RuleMetadata(0, 0, 0.1, RuleStatus.DEPRECATED, Fixtures.NOW, 3)));

        RuleHealth health = updater.healthReport(rules);

        assertEquals(2, health.count(RuleStatus.ACTIVE));
        assertEquals(1, health.count(RuleStatus.DEPRECATED));
        assertEquals(0.4, health.averageConfidence(), 1e-9);
        assertEquals(List.of("a"), health.lowConfidenceRuleIds());
    }
}
