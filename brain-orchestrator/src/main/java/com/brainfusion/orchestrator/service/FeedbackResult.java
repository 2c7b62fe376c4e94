package com.brainfusion.orchestrator.service;

import com.brainfusion.common.model.LearningUpdate;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of feeding one execution report (or one external knowledge payload) through
 * the learning loop. {@code updates} carry their validation status.
 */
public record FeedbackResult(
    @JsonProperty("requestId") String requestId,
    @JsonProperty("generated") int generated,
    @JsonProperty("applied") int applied,
    @JsonProperty("heldForReview") int heldForReview,
    @JsonProperty("rejected") int rejected,
    @JsonProperty("updates") List<LearningUpdate> updates
) {
    public FeedbackResult {
        updates = updates == null ? List.of() : List.copyOf(updates);
    }
}
