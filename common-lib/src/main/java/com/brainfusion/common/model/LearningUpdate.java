package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Candidate change to brain knowledge or reliability, produced by the learning loop.
 *
 * <p>Created {@link ValidationStatus#PENDING}; the validation gate assigns its status exactly
 * once through {@link #withValidation(ValidationResult)}, which returns a new instance.
 */
public record LearningUpdate(
    @JsonProperty("id") String id,
    @JsonProperty("learningType") LearningType learningType,
    @JsonProperty("sourceBrain") String sourceBrain,
    @JsonProperty("targetBrain") String targetBrain,
    @JsonProperty("content") Map<String, Object> content,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("validationStatus") ValidationStatus validationStatus,
    @JsonProperty("validationNotes") List<String> validationNotes,
    @JsonProperty("timestamp") Instant timestamp
) {
    public LearningUpdate {
        content          = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        validationStatus = validationStatus == null ? ValidationStatus.PENDING : validationStatus;
        validationNotes  = validationNotes == null ? List.of() : List.copyOf(validationNotes);
        timestamp        = timestamp == null ? Instant.now() : timestamp;
    }

    public static LearningUpdate of(LearningType type, String sourceBrain, String targetBrain,
                                    Map<String, Object> content, double confidence) {
        return new LearningUpdate(UUID.randomUUID().toString(), type, sourceBrain, targetBrain,
                                  content, confidence, ValidationStatus.PENDING, List.of(), Instant.now());
    }

    @JsonIgnore
    public boolean isValidated() {
        return validationStatus != ValidationStatus.PENDING;
    }

    /**
     * Returns a copy carrying the gate's verdict.
     *
     * @throws IllegalStateException if this update was already validated
     */
    public LearningUpdate withValidation(ValidationResult result) {
        if (isValidated()) {
            throw new IllegalStateException("Learning update " + id + " already validated as " + validationStatus);
        }
        return new LearningUpdate(id, learningType, sourceBrain, targetBrain, content, confidence,
                                  ValidationStatus.of(result.qualityLevel()), result.notes(), timestamp);
    }
}
