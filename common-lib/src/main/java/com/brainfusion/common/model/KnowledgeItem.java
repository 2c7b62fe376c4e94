package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A shareable piece of knowledge owned by one brain.
 *
 * <p>{@code successRate} is the value known when the item was shared and is not recomputed
 * as the item gets used; only {@code usageCount} and {@code lastUsed} change on transfer.
 */
public record KnowledgeItem(
    @JsonProperty("id") String id,
    @JsonProperty("sourceBrain") String sourceBrain,
    @JsonProperty("knowledgeType") KnowledgeType knowledgeType,
    @JsonProperty("title") String title,
    @JsonProperty("description") String description,
    @JsonProperty("applicableContexts") List<String> applicableContexts,
    @JsonProperty("confidenceImpact") double confidenceImpact,
    @JsonProperty("successRate") double successRate,
    @JsonProperty("usageCount") int usageCount,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("lastUsed") Instant lastUsed
) {
    public KnowledgeItem {
        applicableContexts = applicableContexts == null ? List.of() : List.copyOf(applicableContexts);
        createdAt          = createdAt == null ? Instant.now() : createdAt;
    }

    public static KnowledgeItem of(String id, String sourceBrain, KnowledgeType type, String title,
                                   String description, List<String> contexts,
                                   double confidenceImpact, double successRate) {
        return new KnowledgeItem(id, sourceBrain, type, title, description, contexts,
                                 confidenceImpact, successRate, 0, Instant.now(), null);
    }

    public KnowledgeItem withSourceBrain(String brain) {
        return new KnowledgeItem(id, brain, knowledgeType, title, description, applicableContexts,
                                 confidenceImpact, successRate, usageCount, createdAt, lastUsed);
    }

    /** Copy with one more recorded use at {@code usedAt}; success rate is left untouched. */
    public KnowledgeItem withUsage(Instant usedAt) {
        return new KnowledgeItem(id, sourceBrain, knowledgeType, title, description, applicableContexts,
                                 confidenceImpact, successRate, usageCount + 1, createdAt, usedAt);
    }
}
