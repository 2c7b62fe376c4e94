package com.brainfusion.common.exception;

public class KnowledgeNotFoundException extends BrainFusionException {
    private final String knowledgeId;

    public KnowledgeNotFoundException(String knowledgeId) {
        super("Knowledge item not found: " + knowledgeId);
        this.knowledgeId = knowledgeId;
    }

    public String getKnowledgeId() {
        return knowledgeId;
    }
}
