package com.evolver.patch;

import com.evolver.condition.ConditionSpec;
import com.evolver.exception.InvalidProposalException;
import com.evolver.rule.Rule;
import com.evolver.rule.RuleSet;
import com.evolver.rule.RuleStatus;
import com.evolver.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.evolver.support.Fixtures.meta;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for applying proposal edits to rule lists.
 */
class PatchEditorTest {

    private static final Instant LATER = Fixtures.NOW.plusSeconds(60);

    private PatchEditor editor;
    private List<Rule> base;

    @BeforeEach
    void setUp() {
        editor = new PatchEditor(0.4);
        base = List.of(
                Fixtures.captchaRule(),
                Rule.order("fill-after-open", "browser.fill", List.of("browser.open"), meta(0.7)),
                Rule.order("open-after-login", "browser.open", List.of("browser.login"), meta(0.7)));
    }

    @Test
    @DisplayName("ADD_CONDITION edits a copy and leaves the input untouched")
    void addConditionOnCopy() {
        ConditionSpec human = ConditionSpec.equals("human", true);

        RuleSet result = editor.apply(base, proposal(PatchEdit.addCondition("captcha-before-open", human)), LATER);

        Rule edited = result.find("captcha-before-open").orElseThrow();
        assertEquals(List.of(human), edited.conditions());
        assertEquals(LATER, edited.metadata().lastUpdated());
        assertEquals(0.6, edited.confidence());
        assertTrue(base.get(0).conditions().isEmpty());
    }

    @Test
    @DisplayName("ADD_RULE appends a rule with fresh metadata")
    void addRule() {
        Rule learned = Rule.precondition("learned-browser.fill-loggedIn", "browser.fill",
                Map.of("loggedIn", true), meta(0.99));

        RuleSet result = editor.apply(base, proposal(PatchEdit.addRule(learned)), LATER);

        Rule added = result.find(learned.id()).orElseThrow();
        assertEquals(0.4, added.confidence());
        assertEquals(RuleStatus.ACTIVE, added.status());
        assertEquals(LATER, added.metadata().lastUpdated());
        assertEquals(4, result.size());
    }

    @Test
    @DisplayName("DEPRECATE_RULE retires the rule immediately")
    void deprecate() {
        RuleSet result = editor.apply(base, proposal(PatchEdit.deprecateRule("captcha-before-open")), LATER);

        assertEquals(RuleStatus.DEPRECATED, result.find("captcha-before-open").orElseThrow().status());
        assertEquals(2, result.liveCount());
    }

    @Test
    @DisplayName("ADD_ORDER_CONSTRAINT extends the predecessor list")
    void addOrder() {
        RuleSet result = editor.apply(base,
                proposal(PatchEdit.addOrderConstraint("fill-after-open", List.of("browser.login"))), LATER);

        assertEquals(List.of("browser.open", "browser.login"),
                result.find("fill-after-open").orElseThrow().predecessors());
    }

    @Test
    @DisplayName("Invalid edits reject the whole proposal")
    void invalidEdits() {
        assertInvalid(PatchEdit.addCondition("missing-rule", ConditionSpec.exists("x")));
        assertInvalid(PatchEdit.addOrderConstraint("fill-after-open", List.of("browser.open")));
        assertInvalid(PatchEdit.addOrderConstraint("fill-after-open", List.of("browser.fill")));
        assertInvalid(PatchEdit.addRule(Fixtures.captchaRule()));
        // open after fill while fill is already after open
        assertInvalid(PatchEdit.addOrderConstraint("open-after-login", List.of("browser.fill")));
    }

    @Test
    @DisplayName("Adding a condition the rule already has is rejected")
    void duplicateCondition() {
        ConditionSpec human = ConditionSpec.equals("human", true);
        List<Rule> withCondition = List.of(Fixtures.captchaRule().withCondition(human));

        assertThrows(InvalidProposalException.class,
                () -> editor.apply(withCondition, proposal(PatchEdit.addCondition("captcha-before-open", human)), LATER));
    }

    @Test
    @DisplayName("Deprecated rules cannot be edited")
    void deprecatedRulesFrozen() {
        RuleSet deprecated = editor.apply(base, proposal(PatchEdit.deprecateRule("captcha-before-open")), LATER);

        InvalidProposalException e = assertThrows(InvalidProposalException.class,
                () -> editor.apply(deprecated.rules(),
                        proposal(PatchEdit.narrowScope("captcha-before-open", ConditionSpec.exists("x"))), LATER));
        assertEquals("p1", e.getProposalId());
    }

    @Test
    @DisplayName("A failing later edit discards earlier ones")
    void allOrNothing() {
        PatchProposal proposal = new PatchProposal("p2", List.of(
                PatchEdit.addCondition("captcha-before-open", ConditionSpec.equals("human", true)),
                PatchEdit.deprecateRule("missing-rule")),
                new Provenance(ProposalSource.REFLECTION, "task-1", "v0"), "two edits");

        assertThrows(InvalidProposalException.class, () -> editor.apply(base, proposal, LATER));
        assertTrue(base.get(0).conditions().isEmpty());
    }

    private void assertInvalid(PatchEdit edit) {
        assertThrows(InvalidProposalException.class, () -> editor.apply(base, proposal(edit), LATER),
                () -> "expected rejection of " + edit);
    }

    private static PatchProposal proposal(PatchEdit edit) {
        return new PatchProposal("p1", List.of(edit), new Provenance(ProposalSource.REFLECTION, "task-1", "v0"), "test");
    }
}
