package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Verdict of the validation gate for one {@link LearningUpdate}.
 *
 * <p>{@code rawScores} keeps each criterion's unweighted score even when it failed,
 * {@code weightedScores} the contribution actually counted in {@code confidenceScore}.
 */
public record ValidationResult(
    @JsonProperty("updateId") String updateId,
    @JsonProperty("valid") boolean valid,
    @JsonProperty("qualityLevel") QualityLevel qualityLevel,
    @JsonProperty("confidenceScore") double confidenceScore,
    @JsonProperty("criteriaMet") List<String> criteriaMet,
    @JsonProperty("criteriaFailed") List<String> criteriaFailed,
    @JsonProperty("notes") List<String> notes,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("rawScores") Map<String, Double> rawScores,
    @JsonProperty("weightedScores") Map<String, Double> weightedScores,
    @JsonProperty("validationTimeMs") double validationTimeMs,
    @JsonProperty("requiresManualReview") boolean requiresManualReview
) {
    public ValidationResult {
        criteriaMet     = criteriaMet == null ? List.of() : List.copyOf(criteriaMet);
        criteriaFailed  = criteriaFailed == null ? List.of() : List.copyOf(criteriaFailed);
        notes           = notes == null ? List.of() : List.copyOf(notes);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        rawScores       = rawScores == null ? Map.of() : Map.copyOf(rawScores);
        weightedScores  = weightedScores == null ? Map.of() : Map.copyOf(weightedScores);
    }

    /** Result used when the gate itself could not run; the update is never applied. */
    public static ValidationResult failed(String updateId, String reason) {
        return new ValidationResult(updateId, false, QualityLevel.REJECTED, 0.0,
            List.of(), List.of(), List.of("Validation failed: " + reason),
            List.of("Manual review required due to validation error"),
            Map.of(), Map.of(), 0.0, true);
    }
}
