package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered risk severity reported by every brain. Declaration order is severity order.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(RiskLevel other) {
        return compareTo(other) >= 0;
    }

    /** Returns the more severe of the two levels; a {@code null} argument is ignored. */
    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a wire value such as {@code "high"} or {@code "HIGH"}.
     * Unknown or missing values resolve to {@link #MEDIUM}.
     */
    @JsonCreator
    public static RiskLevel fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MEDIUM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
