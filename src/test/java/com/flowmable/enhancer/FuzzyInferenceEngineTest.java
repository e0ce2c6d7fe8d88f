package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end inference: fired rules, defaults, and crisp outputs.
 */
class FuzzyInferenceEngineTest {

    private final FuzzyInferenceEngine engine = new FuzzyInferenceEngine();

    @Test
    void wellBalancedImage_nearNeutralParameters() {
        InferenceResult result = engine.infer(new ImageMetrics(127, 50, 70, 10));
        EnhancementParameters p = result.parameters();

        assertEquals(List.of(5, 13, 27, 30, 39), result.firedRuleIds());
        assertEquals(0.0, p.brightnessAdj());
        assertEquals(1.0, p.contrastAdj(), 1e-3);
        assertEquals(0.9997368421, p.contrastAdj(), 1e-6);
        // sharpen: None clipped at 2/3; denoise: None unclipped
        assertEquals(46.4 / 8.1, p.sharpen(), 1e-9);
        assertEquals(54.0 / 10.5, p.denoise(), 1e-9);
    }

    @Test
    void everyOutputHasACurveWhenAddressed() {
        InferenceResult result = engine.infer(new ImageMetrics(127, 50, 70, 10));
        assertEquals(4, result.aggregatedOutputs().size());
        for (AggregatedOutput out : result.aggregatedOutputs()) {
            assertEquals(Aggregator.SAMPLE_INTERVALS + 1, out.samples().size(), out.variable());
        }
    }

    @Test
    void noRuleFires_allDefaults() {
        InferenceResult result = engine.infer(new ImageMetrics(-10, -10, -10, -10));
        assertTrue(result.firedRules().isEmpty());
        assertEquals(EnhancementParameters.DEFAULT, result.parameters());
        assertTrue(result.parameters().isNeutral());
        assertTrue(result.aggregatedOutputs().stream().allMatch(AggregatedOutput::isEmpty));
    }

    @Test
    void flatImage_contrastBoostedBrightnessUntouched() {
        InferenceResult result = engine.infer(new ImageMetrics(127, 10, 70, 10));
        assertTrue(result.firedRuleIds().contains(10));
        assertTrue(result.aggregatedOutput("brightnessAdj").isEmpty());
        assertEquals(0.0, result.parameters().brightnessAdj());
        assertTrue(result.parameters().contrastAdj() > 1.5, "contrastAdj " + result.parameters().contrastAdj());
    }

    @Test
    void darkImage_brightenedContrastDefaulted() {
        InferenceResult result = engine.infer(new ImageMetrics(80, 50, 70, 10));
        assertTrue(result.firedRuleIds().contains(3));
        assertTrue(result.aggregatedOutput("contrastAdj").isEmpty());
        assertEquals(1.0, result.parameters().contrastAdj());
        assertEquals(40.0, result.parameters().brightnessAdj(), 10.0);
    }

    @Test
    void saturatedSharpness_isFullyVerySharp() {
        InferenceResult result = engine.infer(new ImageMetrics(127, 50, 100, 10));
        assertEquals(1.0, result.fuzzifiedInputs().degree("sharpness", "VerySharp"));
        assertTrue(result.firedRuleIds().contains(28), result.firedRuleIds().toString());
        assertEquals(0.0, result.fuzzifiedInputs().degree("sharpness", "Sharp"));
    }

    @Test
    void inference_isDeterministic() {
        ImageMetrics m = new ImageMetrics(93.5, 31.2, 44.4, 57.9);
        assertEquals(engine.infer(m), engine.infer(m));
        assertEquals(engine.infer(m), new FuzzyInferenceEngine().infer(m));
    }

    @Test
    void randomMetrics_stayInsideUniverses() {
        Random random = new Random(42);
        for (int i = 0; i < 500; i++) {
            ImageMetrics m = new ImageMetrics(
                    random.nextDouble() * 255,
                    random.nextDouble() * 100,
                    random.nextDouble() * 100,
                    random.nextDouble() * 100);
            InferenceResult result = engine.infer(m);
            EnhancementParameters p = result.parameters();

            assertTrue(p.brightnessAdj() >= -100 && p.brightnessAdj() <= 100, m + " -> " + p);
            assertTrue(p.contrastAdj() >= 0.5 && p.contrastAdj() <= 2.0, m + " -> " + p);
            assertTrue(p.sharpen() >= 0 && p.sharpen() <= 100, m + " -> " + p);
            assertTrue(p.denoise() >= 0 && p.denoise() <= 100, m + " -> " + p);

            int previous = 0;
            for (FiredRule fired : result.firedRules()) {
                assertTrue(fired.firingStrength() > 0 && fired.firingStrength() <= 1);
                assertTrue(fired.rule().id() > previous, "fired rules out of order");
                previous = fired.rule().id();
            }
        }
    }

    @Test
    void uniformGreyImage_boostsContrastAndSharpens() {
        BufferedImage grey = new BufferedImage(16, 16, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < 16; y++) {
            for (int x = 0; x < 16; x++) {
                grey.setRGB(x, y, 0x7F7F7F);
            }
        }

        ImageMetrics m = engine.analyze(grey);
        assertEquals(127.0, m.brightness(), 1e-9);
        assertEquals(0.0, m.contrast(), 1e-9);

        InferenceResult result = engine.infer(grey);
        assertTrue(result.firedRuleIds().containsAll(List.of(10, 17, 19, 30)), result.firedRuleIds().toString());
        assertTrue(result.parameters().contrastAdj() > 1.5);
        assertTrue(result.parameters().sharpen() > 45);
    }

    @Test
    void invalidCustomRules_rejectedAtConstruction() {
        FuzzyRule bad = new FuzzyRule(1,
                List.of(new FuzzyRule.Condition("gamma", "High")),
                List.of(new FuzzyRule.Assignment("sharpen", "Low")));
        assertThrows(IllegalStateException.class, () -> new FuzzyInferenceEngine(List.of(bad)));
    }

    @Test
    void customRulesOutOfIdOrder_rejectedAtConstruction() {
        List<FuzzyRule> rules = RuleBase.rules();
        assertThrows(IllegalStateException.class,
                () -> new FuzzyInferenceEngine(List.of(rules.get(12), rules.get(4))));
    }

    @Test
    void customRulesInIdOrder_firedInIdOrder() {
        List<FuzzyRule> rules = RuleBase.rules();
        InferenceResult result = new FuzzyInferenceEngine(List.of(rules.get(4), rules.get(12)))
                .infer(new ImageMetrics(127, 50, 70, 10));
        assertEquals(List.of(5, 13), result.firedRuleIds());
    }

    @Test
    void customRuleSubset_onlyThoseRulesFire() {
        FuzzyInferenceEngine exposureOnly = new FuzzyInferenceEngine(RuleBase.rules().subList(0, 9));
        InferenceResult result = exposureOnly.infer(new ImageMetrics(127, 50, 70, 10));
        assertEquals(List.of(5), result.firedRuleIds());
        assertEquals(0.0, result.parameters().sharpen());
        assertEquals(0.0, result.parameters().denoise());
    }
}
