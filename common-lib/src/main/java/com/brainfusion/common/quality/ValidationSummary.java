package com.brainfusion.common.quality;

import com.brainfusion.common.model.LearningType;
import com.brainfusion.common.model.QualityLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Compact record of one validation, kept after the full {@code ValidationResult} is discarded.
 */
public record ValidationSummary(
    @JsonProperty("updateId") String updateId,
    @JsonProperty("targetBrain") String targetBrain,
    @JsonProperty("learningType") LearningType learningType,
    @JsonProperty("valid") boolean valid,
    @JsonProperty("qualityLevel") QualityLevel qualityLevel,
    @JsonProperty("score") double score,
    @JsonProperty("criteriaMet") int criteriaMet,
    @JsonProperty("criteriaFailed") int criteriaFailed,
    @JsonProperty("timestamp") Instant timestamp
) {}
