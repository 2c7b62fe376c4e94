package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExecutionOutcome {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILURE,
    TIMEOUT,
    ERROR;

    /** Partial success counts as success for every learning counter. */
    public boolean isSuccessful() {
        return this == SUCCESS || this == PARTIAL_SUCCESS;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionOutcome fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("execution outcome is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution outcome: " + value, e);
        }
    }
}
