package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum KnowledgeType {
    PATTERN_RECOGNITION,
    DECISION_STRATEGY,
    ERROR_HANDLING,
    OPTIMIZATION_TECHNIQUE,
    CONTEXT_UNDERSTANDING,
    CONFIDENCE_CALIBRATION;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static KnowledgeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("knowledge type is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown knowledge type: " + value, e);
        }
    }
}
