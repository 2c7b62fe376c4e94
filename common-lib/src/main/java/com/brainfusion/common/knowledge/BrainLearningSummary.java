package com.brainfusion.common.knowledge;

import com.brainfusion.common.model.KnowledgeType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record BrainLearningSummary(
    @JsonProperty("brainId") String brainId,
    @JsonProperty("timeWindowDays") long timeWindowDays,
    @JsonProperty("knowledgeShared") int knowledgeShared,
    @JsonProperty("knowledgeReceived") int knowledgeReceived,
    @JsonProperty("learningRequests") int learningRequests,
    @JsonProperty("averageSuccessRate") double averageSuccessRate,
    @JsonProperty("topKnowledgeTypes") List<KnowledgeType> topKnowledgeTypes,
    @JsonProperty("learningActivityScore") double learningActivityScore
) {}
