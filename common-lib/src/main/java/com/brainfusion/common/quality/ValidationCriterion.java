package com.brainfusion.common.quality;

/**
 * The six criteria of the learning-update gate, with their default weights.
 * Default weights sum to 1.0.
 */
public enum ValidationCriterion {
    CONFIDENCE_THRESHOLD("confidence_threshold", 0.20),
    SOURCE_RELIABILITY("source_reliability", 0.25),
    CONTENT_COMPLETENESS("content_completeness", 0.15),
    CONSISTENCY_CHECK("consistency_check", 0.20),
    IMPACT_ASSESSMENT("impact_assessment", 0.10),
    SAFETY_VALIDATION("safety_validation", 0.10);

    private final String key;
    private final double defaultWeight;

    ValidationCriterion(String key, double defaultWeight) {
        this.key           = key;
        this.defaultWeight = defaultWeight;
    }

    public String key() {
        return key;
    }

    public double defaultWeight() {
        return defaultWeight;
    }
}
