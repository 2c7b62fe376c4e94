package com.brainfusion.common.quality;

import com.brainfusion.common.exception.ConfigurationException;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunables of {@link QualityAssuranceValidator}. Construction fails fast with a
 * {@link ConfigurationException} when the settings cannot produce a meaningful gate.
 */
public record QualityGateSettings(
    Map<ValidationCriterion, Double> weights,
    double minimumConfidence,
    List<String> trustedSources,
    List<String> blacklistedSources,
    int historyPerTarget,
    int consistencyWindow,
    double contradictionTolerance,
    double highImpactThreshold
) {
    static final double WEIGHT_TOLERANCE = 1e-9;

    public static final double DEFAULT_MINIMUM_CONFIDENCE      = 0.3;
    public static final int    DEFAULT_HISTORY_PER_TARGET      = 100;
    public static final int    DEFAULT_CONSISTENCY_WINDOW      = 10;
    public static final double DEFAULT_CONTRADICTION_TOLERANCE = 0.3;
    public static final double DEFAULT_HIGH_IMPACT_THRESHOLD   = 0.8;

    public QualityGateSettings {
        Map<ValidationCriterion, Double> resolved = new EnumMap<>(ValidationCriterion.class);
        for (ValidationCriterion criterion : ValidationCriterion.values()) {
            Double configured = weights == null ? null : weights.get(criterion);
            double weight = configured != null ? configured : criterion.defaultWeight();
            if (weight < 0.0) {
                throw new ConfigurationException("Negative weight for criterion " + criterion.key() + ": " + weight);
            }
            resolved.put(criterion, weight);
        }
        double sum = resolved.values().stream().mapToDouble(Double::doubleValue).sum();
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new ConfigurationException("Validation criterion weights must sum to 1.0 but sum to " + sum);
        }
        if (minimumConfidence <= 0.0 || minimumConfidence > 1.0) {
            throw new ConfigurationException("minimumConfidence must be in (0, 1]: " + minimumConfidence);
        }
        if (historyPerTarget < 1 || consistencyWindow < 1 || consistencyWindow > historyPerTarget) {
            throw new ConfigurationException("Invalid history sizing: historyPerTarget=" + historyPerTarget
                + " consistencyWindow=" + consistencyWindow);
        }
        trustedSources     = trustedSources == null ? List.of() : List.copyOf(trustedSources);
        blacklistedSources = blacklistedSources == null ? List.of() : List.copyOf(blacklistedSources);
        Set<String> overlap = new HashSet<>(trustedSources);
        overlap.retainAll(blacklistedSources);
        if (!overlap.isEmpty()) {
            throw new ConfigurationException("Sources both trusted and blacklisted: " + overlap);
        }
        weights = Map.copyOf(resolved);
    }

    public static QualityGateSettings defaults() {
        return withSources(List.of(), List.of());
    }

    public static QualityGateSettings withSources(List<String> trusted, List<String> blacklisted) {
        return new QualityGateSettings(Map.of(), DEFAULT_MINIMUM_CONFIDENCE, trusted, blacklisted,
            DEFAULT_HISTORY_PER_TARGET, DEFAULT_CONSISTENCY_WINDOW,
            DEFAULT_CONTRADICTION_TOLERANCE, DEFAULT_HIGH_IMPACT_THRESHOLD);
    }

    public double weight(ValidationCriterion criterion) {
        return weights.get(criterion);
    }
}
