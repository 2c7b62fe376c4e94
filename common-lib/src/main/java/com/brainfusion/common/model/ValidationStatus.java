package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a {@link LearningUpdate}: {@link #PENDING} until the validation gate runs,
 * then the granted {@link QualityLevel}.
 */
public enum ValidationStatus {
    PENDING,
    HIGH,
    MEDIUM,
    LOW,
    REJECTED;

    public static ValidationStatus of(QualityLevel level) {
        return switch (level) {
            case HIGH     -> HIGH;
            case MEDIUM   -> MEDIUM;
            case LOW      -> LOW;
            case REJECTED -> REJECTED;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ValidationStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("validation status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown validation status: " + value, e);
        }
    }
}
