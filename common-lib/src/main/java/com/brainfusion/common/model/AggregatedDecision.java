package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The single decision handed to the execution layer for one request.
 * Created once by the orchestrator and never modified afterwards.
 */
public record AggregatedDecision(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("overallConfidence") double overallConfidence,
    @JsonProperty("executionStrategy") ExecutionStrategy executionStrategy,
    @JsonProperty("riskAssessment") RiskAssessment riskAssessment,
    @JsonProperty("recommendedActions") List<String> recommendedActions,
    @JsonProperty("contributingBrains") List<String> contributingBrains,
    @JsonProperty("processingTimeMs") long processingTimeMs,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("createdAt") Instant createdAt
) {
    public static final int MAX_RECOMMENDED_ACTIONS = 10;

    public static final String META_TIMED_OUT     = "timedOut";
    public static final String META_DEGRADED      = "degraded";
    public static final String META_SME_CONSULTED = "smeConsulted";
    public static final String META_SME_FAILED    = "smeFailed";

    public AggregatedDecision {
        recommendedActions = recommendedActions == null ? List.of()
            : List.copyOf(recommendedActions.subList(0, Math.min(recommendedActions.size(), MAX_RECOMMENDED_ACTIONS)));
        contributingBrains = contributingBrains == null ? List.of() : List.copyOf(contributingBrains);
        metadata           = metadata == null ? Map.of() : Map.copyOf(metadata);
        createdAt          = createdAt == null ? Instant.now() : createdAt;
    }

    @JsonIgnore
    public boolean isDegraded() {
        return riskAssessment != null && riskAssessment.hasError();
    }
}
