package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Natural-language request submitted for a decision. {@code requestId} is optional; one is
 * generated when absent and later keys the execution feedback.
 */
public record DecisionRequest(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("text") String text,
    @JsonProperty("context") Map<String, Object> context
) {
    public DecisionRequest {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static DecisionRequest of(String text) {
        return new DecisionRequest(null, text, Map.of());
    }

    /** The caller's id, or a fresh UUID when none was supplied. */
    public String resolvedRequestId() {
        return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }
}
