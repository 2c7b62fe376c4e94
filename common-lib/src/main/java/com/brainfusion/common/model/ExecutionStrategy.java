package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the execution layer should carry out a decision.
 */
public enum ExecutionStrategy {
    AUTOMATED_EXECUTION,
    GUIDED_EXECUTION,
    ASSISTED_EXECUTION,
    MANUAL_REVIEW,
    INFORMATIONAL_RESPONSE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("execution strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution strategy: " + value, e);
        }
    }
}
