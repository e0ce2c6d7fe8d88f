package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The static rule table: size, order, and load-time validation.
 */
class RuleBaseTest {

    @Test
    void fiftyRules_inIdOrder() {
        List<FuzzyRule> rules = RuleBase.rules();
        assertEquals(RuleBase.RULE_COUNT, rules.size());
        assertEquals(IntStream.rangeClosed(1, 50).boxed().toList(),
                rules.stream().map(FuzzyRule::id).toList());
    }

    @Test
    void rulesAreImmutable() {
        List<FuzzyRule> rules = RuleBase.rules();
        assertThrows(UnsupportedOperationException.class, () -> rules.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> rules.get(0).conditions().clear());
    }

    @Test
    void rule5_pairsNormalBrightnessWithMediumContrast() {
        FuzzyRule rule = RuleBase.rules().get(4);
        assertEquals(5, rule.id());
        assertEquals(List.of(
                new FuzzyRule.Condition("brightness", "Normal"),
                new FuzzyRule.Condition("contrast", "Medium")), rule.conditions());
        assertEquals(List.of(
                new FuzzyRule.Assignment("brightnessAdj", "NoChange"),
                new FuzzyRule.Assignment("contrastAdj", "NoChange")), rule.assignments());
    }

    @Test
    void rule39_coversAllFourVariables() {
        FuzzyRule rule = RuleBase.rules().get(38);
        assertEquals(4, rule.conditions().size());
        assertEquals(4, rule.assignments().size());
    }

    @Test
    void descriptions_generatedWhenAbsent() {
        FuzzyRule rule1 = RuleBase.rules().get(0);
        assertEquals("IF brightness is VeryDark THEN brightnessAdj is LargeIncrease, contrastAdj is SmallIncrease",
                rule1.description());
        for (FuzzyRule rule : RuleBase.rules()) {
            assertFalse(rule.description().isBlank(), "Rule " + rule.id());
        }
    }

    @Test
    void unknownTerm_failsAtLoad() {
        FuzzyRule bad = new FuzzyRule(99,
                List.of(new FuzzyRule.Condition("brightness", "Dim")),
                List.of(new FuzzyRule.Assignment("brightnessAdj", "NoChange")));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> RuleBase.validate(List.of(bad)));
        assertTrue(e.getMessage().contains("99"), e.getMessage());
        assertTrue(e.getMessage().contains("Dim"), e.getMessage());
    }

    @Test
    void outputVariableInAntecedent_failsAtLoad() {
        FuzzyRule bad = new FuzzyRule(7,
                List.of(new FuzzyRule.Condition("sharpen", "None")),
                List.of(new FuzzyRule.Assignment("denoise", "Low")));
        assertThrows(IllegalStateException.class, () -> RuleBase.validate(List.of(bad)));
    }

    @Test
    void unknownConsequentTerm_failsAtLoad() {
        FuzzyRule bad = new FuzzyRule(8,
                List.of(new FuzzyRule.Condition("noise", "Heavy")),
                List.of(new FuzzyRule.Assignment("denoise", "Maximum")));
        assertThrows(IllegalStateException.class, () -> RuleBase.validate(List.of(bad)));
    }

    @Test
    void duplicateIds_failAtLoad() {
        FuzzyRule first = RuleBase.rules().get(0);
        assertThrows(IllegalStateException.class, () -> RuleBase.validate(List.of(first, first)));
    }

    @Test
    void descendingIds_failAtLoad() {
        List<FuzzyRule> rules = RuleBase.rules();
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> RuleBase.validate(List.of(rules.get(12), rules.get(4))));
        assertTrue(e.getMessage().contains("5"), e.getMessage());
        assertTrue(e.getMessage().contains("13"), e.getMessage());
    }

    @Test
    void gapsInIds_allowed() {
        List<FuzzyRule> rules = RuleBase.rules();
        assertEquals(List.of(rules.get(4), rules.get(12)), RuleBase.validate(List.of(rules.get(4), rules.get(12))));
    }

    @Test
    void emptyAntecedent_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new FuzzyRule(1, List.of(),
                List.of(new FuzzyRule.Assignment("denoise", "Low"))));
    }
}
