package com.brainfusion.common.quality;

import com.brainfusion.common.model.QualityLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of the gate's running statistics.
 * {@code trend} is one of {@code improving}, {@code stable}, {@code declining}.
 */
public record QualityMetrics(
    @JsonProperty("totalValidations") long totalValidations,
    @JsonProperty("successfulValidations") long successfulValidations,
    @JsonProperty("failedValidations") long failedValidations,
    @JsonProperty("successRate") double successRate,
    @JsonProperty("averageQualityScore") double averageQualityScore,
    @JsonProperty("qualityDistribution") Map<QualityLevel, Long> qualityDistribution,
    @JsonProperty("averageValidationTimeMs") double averageValidationTimeMs,
    @JsonProperty("trend") String trend,
    @JsonProperty("trustedSources") int trustedSources,
    @JsonProperty("blacklistedSources") int blacklistedSources
) {}
