package com.flowmable.enhancer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private final Aggregator aggregator = new Aggregator();

    private static FiredRule fired(int ruleIndex, String variable, String term, double strength) {
        MembershipFunction mf = LinguisticVariables.output(variable).term(term);
        return new FiredRule(RuleBase.rules().get(ruleIndex), strength,
                List.of(new ClippedOutput(variable, term, mf, strength)));
    }

    @Test
    void sampleGrid_hasExactEndpoints() {
        double[] xs = Aggregator.sampleGrid(0.5, 2.0);
        assertEquals(101, xs.length);
        assertEquals(0.5, xs[0]);
        assertEquals(2.0, xs[100]);
        assertEquals(1.25, xs[50], 1e-12);
        for (int i = 1; i < xs.length; i++) {
            assertTrue(xs[i] > xs[i - 1]);
        }
    }

    @Test
    void sampleGrid_integerUniverseLandsOnIntegers() {
        double[] xs = Aggregator.sampleGrid(-100, 100);
        assertEquals(-100.0, xs[0]);
        assertEquals(0.0, xs[50]);
        assertEquals(100.0, xs[100]);
    }

    @Test
    void nothingFired_everyOutputEmpty() {
        List<AggregatedOutput> outputs = aggregator.aggregate(List.of());
        assertEquals(List.of("brightnessAdj", "contrastAdj", "sharpen", "denoise"),
                outputs.stream().map(AggregatedOutput::variable).toList());
        assertTrue(outputs.stream().allMatch(AggregatedOutput::isEmpty));
    }

    @Test
    void onlyAddressedVariablesGetCurves() {
        List<AggregatedOutput> outputs = aggregator.aggregate(List.of(fired(2, "brightnessAdj", "SmallIncrease", 0.5)));
        assertFalse(outputs.get(0).isEmpty());
        assertEquals(101, outputs.get(0).samples().size());
        assertTrue(outputs.get(1).isEmpty());
        assertTrue(outputs.get(2).isEmpty());
        assertTrue(outputs.get(3).isEmpty());
        assertEquals(0.5, outputs.get(0).maxDegree(), 1e-12);
    }

    @Test
    void aggregate_isPointwiseMaxOfClippedOutputs() {
        FiredRule noChange = fired(12, "contrastAdj", "NoChange", 0.5);
        FiredRule smallIncrease = fired(11, "contrastAdj", "SmallIncrease", 0.8);
        AggregatedOutput out = aggregator.aggregate(LinguisticVariables.CONTRAST_ADJ_VARIABLE,
                List.of(noChange, smallIncrease));

        for (AggregatedOutput.Sample s : out.samples()) {
            double a = noChange.outputs().get(0).degreeAt(s.x());
            double b = smallIncrease.outputs().get(0).degreeAt(s.x());
            assertTrue(s.degree() >= a && s.degree() >= b, "x=" + s.x());
            assertEquals(Math.max(a, b), s.degree(), 1e-12);
        }
        assertEquals(0.8, out.maxDegree(), 1e-12);
    }

    @Test
    void aggregate_orderOfFiredRulesIrrelevant() {
        FiredRule a = fired(12, "contrastAdj", "NoChange", 0.5);
        FiredRule b = fired(11, "contrastAdj", "SmallIncrease", 0.8);
        assertEquals(aggregator.aggregate(List.of(a, b)), aggregator.aggregate(List.of(b, a)));
    }

    @Test
    void degreesStayWithinUnitInterval() {
        AggregatedOutput out = aggregator.aggregate(LinguisticVariables.SHARPEN_VARIABLE, List.of(
                fired(17, "sharpen", "Low", 1.0),
                fired(18, "sharpen", "Medium", 0.3)));
        for (AggregatedOutput.Sample s : out.samples()) {
            assertTrue(s.degree() >= 0.0 && s.degree() <= 1.0);
        }
    }
}
