package com.brainfusion.common.model;

import java.util.Locale;

/**
 * Kind of action the intent brain believes the user is asking for.
 * Only {@link #INFORMATION} changes strategy selection; the rest are carried for learning keys.
 */
public enum ActionType {
    INFORMATION,
    OPERATIONAL,
    DIAGNOSTIC,
    PROVISIONING,
    UNKNOWN;

    public static ActionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("INFORMATIONAL".equals(normalized)) {
            return INFORMATION;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
