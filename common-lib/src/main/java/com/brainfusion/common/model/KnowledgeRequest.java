package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KnowledgeRequest(
    @JsonProperty("requestingBrain") String requestingBrain,
    @JsonProperty("knowledgeType") KnowledgeType knowledgeType,
    @JsonProperty("context") String context
) {
    public static KnowledgeRequest of(String requestingBrain, KnowledgeType type, String context) {
        return new KnowledgeRequest(requestingBrain, type, context);
    }
}
