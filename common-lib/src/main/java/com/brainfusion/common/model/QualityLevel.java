package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Quality grade assigned by the validation gate, derived from the weighted overall score.
 */
public enum QualityLevel {
    HIGH(0.8, 1.0),
    MEDIUM(0.6, 0.7),
    LOW(0.4, 0.4),
    REJECTED(0.0, 0.0);

    private final double minimumScore;
    private final double learningValue;

    QualityLevel(double minimumScore, double learningValue) {
        this.minimumScore  = minimumScore;
        this.learningValue = learningValue;
    }

    /** Nominal value of an update at this grade, used for learning-quality averages. */
    public double learningValue() {
        return learningValue;
    }

    public static QualityLevel fromScore(double score) {
        if (score >= HIGH.minimumScore)   return HIGH;
        if (score >= MEDIUM.minimumScore) return MEDIUM;
        if (score >= LOW.minimumScore)    return LOW;
        return REJECTED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static QualityLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("quality level is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown quality level: " + value, e);
        }
    }
}
