package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Real-world result of executing a prior decision, keyed by that decision's request id.
 *
 * <p>{@code executionTimeSeconds}, {@code userSatisfaction} and {@code errorDetails} are optional.
 * {@code confidenceAccuracy} defaults to 0.8 on a successful outcome and 0.2 otherwise.
 */
public record ExecutionFeedback(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("outcome") ExecutionOutcome outcome,
    @JsonProperty("confidenceAccuracy") Double confidenceAccuracy,
    @JsonProperty("executionTimeSeconds") Double executionTimeSeconds,
    @JsonProperty("userSatisfaction") Double userSatisfaction,
    @JsonProperty("errorDetails") String errorDetails,
    @JsonProperty("timestamp") Instant timestamp
) {
    static final double DEFAULT_SUCCESS_ACCURACY = 0.8;
    static final double DEFAULT_FAILURE_ACCURACY = 0.2;

    public ExecutionFeedback {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome is required");
        }
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static ExecutionFeedback of(String requestId, ExecutionOutcome outcome) {
        return new ExecutionFeedback(requestId, outcome, null, null, null, null, Instant.now());
    }

    public ExecutionFeedback withRequestId(String id) {
        return new ExecutionFeedback(id, outcome, confidenceAccuracy, executionTimeSeconds,
                                     userSatisfaction, errorDetails, timestamp);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return outcome.isSuccessful();
    }

    /** Accuracy of the original confidence, clamped to [0,1], with the outcome-based default. */
    public double effectiveConfidenceAccuracy() {
        double raw = confidenceAccuracy != null ? confidenceAccuracy
            : (isSuccessful() ? DEFAULT_SUCCESS_ACCURACY : DEFAULT_FAILURE_ACCURACY);
        return Math.max(0.0, Math.min(1.0, raw));
    }
}
