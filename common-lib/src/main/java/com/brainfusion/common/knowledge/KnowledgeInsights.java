package com.brainfusion.common.knowledge;

import com.brainfusion.common.model.KnowledgeType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * System-wide view of the knowledge store. Ranked maps iterate from highest to lowest.
 */
public record KnowledgeInsights(
    @JsonProperty("totalKnowledgeItems") int totalKnowledgeItems,
    @JsonProperty("totalTransfers") int totalTransfers,
    @JsonProperty("totalRequests") int totalRequests,
    @JsonProperty("mostActiveBrains") Map<String, Long> mostActiveBrains,
    @JsonProperty("mostUsedKnowledgeTypes") Map<KnowledgeType, Long> mostUsedKnowledgeTypes,
    @JsonProperty("averageKnowledgeUsage") double averageKnowledgeUsage
) {}
