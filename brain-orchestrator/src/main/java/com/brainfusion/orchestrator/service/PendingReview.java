package com.brainfusion.orchestrator.service;

import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.ValidationResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A valid update held back because its impact or safety gate asked for a human look. */
public record PendingReview(
    @JsonProperty("update") LearningUpdate update,
    @JsonProperty("validation") ValidationResult validation,
    @JsonProperty("queuedAt") Instant queuedAt
) {
    public String id() {
        return update.id();
    }
}
