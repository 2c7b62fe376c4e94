package com.brainfusion.common.aggregation;

import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.SmeConsultation;

import java.util.List;
import java.util.Map;

/**
 * Fuses intent, technical and SME confidences into one overall confidence.
 *
 * <h3>Formula</h3>
 * <pre>
 *   scaled(c, brain)  = clamp(c × reliability(brain))          reliability defaults to 1.0
 *   smeConfidence     = mean(scaled SME confidences)            failed consultations excluded,
 *                                                               0.5 when none remain
 *   overall           = clamp(intent × 0.4 + technical × 0.4 + smeConfidence × 0.2)
 * </pre>
 *
 * <p>Free-text SME answers contribute {@value SmeConsultation#FREE_TEXT_CONFIDENCE} before scaling.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class ConfidenceAggregator {

    public static final double INTENT_WEIGHT    = 0.4;
    public static final double TECHNICAL_WEIGHT = 0.4;
    public static final double SME_WEIGHT       = 0.2;

    static final double DEFAULT_SME_CONFIDENCE = 0.5;
    static final double NEUTRAL_RELIABILITY    = 1.0;

    private ConfidenceAggregator() {}

    /** Sum of the three fusion weights; exactly 1.0. */
    public static double weightSum() {
        return INTENT_WEIGHT + TECHNICAL_WEIGHT + SME_WEIGHT;
    }

    /**
     * Plain numeric fusion with no reliability scaling.
     *
     * @param smeConfidences confidences of the SME consultations that succeeded (may be empty)
     */
    public static double aggregate(double intentConfidence, double technicalConfidence,
                                   List<Double> smeConfidences) {
        double sme = smeConfidences == null || smeConfidences.isEmpty()
            ? DEFAULT_SME_CONFIDENCE
            : smeConfidences.stream().mapToDouble(ConfidenceAggregator::clamp).average().orElse(DEFAULT_SME_CONFIDENCE);
        return fuse(clamp(intentConfidence), clamp(technicalConfidence), sme);
    }

    public static double aggregate(BrainAnalysis intent, BrainAnalysis technical,
                                   List<SmeConsultation> consultations) {
        return aggregate(intent, technical, consultations, Map.of());
    }

    /**
     * Full fusion with per-brain reliability multipliers.
     *
     * @param reliability multiplier per brain id; brains without an entry are not scaled
     */
    public static double aggregate(BrainAnalysis intent, BrainAnalysis technical,
                                   List<SmeConsultation> consultations,
                                   Map<String, Double> reliability) {
        Map<String, Double> weights = reliability == null ? Map.of() : reliability;
        double intentScaled    = scale(intent.confidence(), intent.brainId(), weights);
        double technicalScaled = scale(technical.confidence(), technical.brainId(), weights);
        return fuse(intentScaled, technicalScaled, smeConfidence(consultations, weights));
    }

    /**
     * Mean reliability-scaled confidence of the non-failed consultations,
     * {@value DEFAULT_SME_CONFIDENCE} when there are none.
     */
    public static double smeConfidence(List<SmeConsultation> consultations, Map<String, Double> reliability) {
        if (consultations == null || consultations.isEmpty()) {
            return DEFAULT_SME_CONFIDENCE;
        }
        Map<String, Double> weights = reliability == null ? Map.of() : reliability;
        return consultations.stream()
            .filter(c -> !c.isError())
            .mapToDouble(c -> scale(c.confidence(), smeBrainId(c), weights))
            .average()
            .orElse(DEFAULT_SME_CONFIDENCE);
    }

    private static String smeBrainId(SmeConsultation consultation) {
        if (consultation instanceof SmeConsultation.Structured structured) {
            return structured.analysis().brainId();
        }
        return BrainDescriptor.smeBrainId(consultation.domain());
    }

    private static double scale(double confidence, String brainId, Map<String, Double> reliability) {
        double multiplier = brainId == null ? NEUTRAL_RELIABILITY
            : reliability.getOrDefault(brainId, NEUTRAL_RELIABILITY);
        return clamp(clamp(confidence) * multiplier);
    }

    private static double fuse(double intent, double technical, double sme) {
        return clamp(intent    * INTENT_WEIGHT
                   + technical * TECHNICAL_WEIGHT
                   + sme       * SME_WEIGHT);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
