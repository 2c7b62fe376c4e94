package com.brainfusion.common.aggregation;

import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link ConfidenceAggregator}.
 */
class ConfidenceAggregatorTest {

    private static final double EPS = 1e-9;

    private static BrainAnalysis analysis(String brainId, double confidence) {
        return BrainAnalysis.of(brainId, confidence, RiskLevel.LOW, Map.of());
    }

    private static SmeConsultation sme(String domain, double confidence) {
        return new SmeConsultation.Structured(domain, analysis("sme_" + domain, confidence));
    }

    // ── weights ────────────────────────────────────────────────────────────

    @Test
    @DisplayName("fusion weights sum to exactly 1.0")
    void weightsSumToOne() {
        assertEquals(1.0, ConfidenceAggregator.weightSum(), EPS);
    }

    // ── numeric fusion ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("aggregate(double, double, List)")
    class NumericFusion {

        @Test
        @DisplayName("intent 0.9, technical 0.85, SMEs {0.7, 0.6} → 0.83")
        void twoSmes() {
            assertEquals(0.83, ConfidenceAggregator.aggregate(0.9, 0.85, List.of(0.7, 0.6)), 1e-6);
        }

        @Test
        @DisplayName("no SME → SME term defaults to 0.5")
        void emptySmeList() {
            assertEquals(0.9 * 0.4 + 0.7 * 0.4 + 0.5 * 0.2,
                ConfidenceAggregator.aggregate(0.9, 0.7, List.of()), EPS);
        }

        @Test
        @DisplayName("null SME list behaves like an empty list")
        void nullSmeList() {
            assertEquals(ConfidenceAggregator.aggregate(0.4, 0.6, List.of()),
                ConfidenceAggregator.aggregate(0.4, 0.6, null), EPS);
        }

        @Test
        @DisplayName("out-of-range inputs are clamped into [0,1]")
        void outOfRangeInputs() {
            double high = ConfidenceAggregator.aggregate(7.0, 3.0, List.of(9.0));
            double low  = ConfidenceAggregator.aggregate(-2.0, -1.0, List.of(-5.0));
            assertEquals(1.0, high, EPS);
            assertEquals(0.0, low, EPS);
        }

        @Test
        @DisplayName("result always in [0,1] across a grid of inputs")
        void clampProperty() {
            for (double i : Arrays.asList(-1.0, 0.0, 0.3, 0.99, 1.0, 2.5, Double.NaN)) {
                for (double t : Arrays.asList(-0.5, 0.0, 0.5, 1.0, 4.0)) {
                    double result = ConfidenceAggregator.aggregate(i, t, List.of(i, t));
                    assertTrue(result >= 0.0 && result <= 1.0, "out of range for " + i + "," + t);
                }
            }
        }
    }

    // ── analysis fusion ────────────────────────────────────────────────────

    @Nested
    @DisplayName("aggregate(BrainAnalysis, …)")
    class AnalysisFusion {

        @Test
        @DisplayName("failed consultations are excluded from the SME mean")
        void failedExcluded() {
            List<SmeConsultation> consultations = List.of(
                sme("security", 0.7),
                new SmeConsultation.Failed("database", "timeout"));
            double result = ConfidenceAggregator.aggregate(
                analysis("intent_brain", 0.8), analysis("technical_brain", 0.8), consultations);
            assertEquals(0.8 * 0.4 + 0.8 * 0.4 + 0.7 * 0.2, result, EPS);
        }

        @Test
        @DisplayName("only failed consultations → SME term 0.5")
        void allFailed() {
            double result = ConfidenceAggregator.smeConfidence(
                List.of(new SmeConsultation.Failed("database", "boom")), Map.of());
            assertEquals(0.5, result, EPS);
        }

        @Test
        @DisplayName("free-text SME answer counts as 0.5")
        void freeText() {
            double result = ConfidenceAggregator.smeConfidence(
                List.of(new SmeConsultation.FreeText("network", "looks fine"), sme("security", 0.9)), Map.of());
            assertEquals(0.7, result, EPS);
        }

        @Test
        @DisplayName("reliability multipliers scale each brain before fusion, then clamp")
        void reliabilityScaling() {
            Map<String, Double> reliability = Map.of("intent_brain", 1.5, "technical_brain", 0.5);
            double result = ConfidenceAggregator.aggregate(
                analysis("intent_brain", 0.8), analysis("technical_brain", 0.8), List.of(), reliability);
            assertEquals(1.0 * 0.4 + 0.4 * 0.4 + 0.5 * 0.2, result, EPS);
        }
    }
}
