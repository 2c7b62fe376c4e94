package com.brainfusion.common.learning;

import com.brainfusion.common.model.QualityLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Snapshot of the learning loop's history. */
public record LearningMetrics(
    @JsonProperty("totalLearningUpdates") long totalLearningUpdates,
    @JsonProperty("successfulIntegrations") long successfulIntegrations,
    @JsonProperty("failedIntegrations") long failedIntegrations,
    @JsonProperty("averageLearningQuality") double averageLearningQuality,
    @JsonProperty("qualityDistribution") Map<QualityLevel, Long> qualityDistribution,
    @JsonProperty("recentActivity") long recentActivity,
    @JsonProperty("recentUpdates") List<RecentLearningUpdate> recentUpdates
) {
    /** Condensed view of one recorded update. */
    public record RecentLearningUpdate(
        @JsonProperty("id") String id,
        @JsonProperty("learningType") String learningType,
        @JsonProperty("sourceBrain") String sourceBrain,
        @JsonProperty("targetBrain") String targetBrain,
        @JsonProperty("validationStatus") String validationStatus,
        @JsonProperty("contentSummary") String contentSummary,
        @JsonProperty("timestamp") Instant timestamp
    ) {}
}
