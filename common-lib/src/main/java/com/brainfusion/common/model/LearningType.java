package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LearningType {
    EXECUTION_FEEDBACK,
    PATTERN_RECOGNITION,
    EXTERNAL_KNOWLEDGE,
    CROSS_BRAIN_INSIGHT,
    ERROR_CORRECTION;

    /** Types whose content can change behaviour across many future decisions. */
    public boolean isHighImpact() {
        return this == ERROR_CORRECTION || this == EXTERNAL_KNOWLEDGE;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LearningType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("learning type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown learning type: " + value, e);
        }
    }
}
