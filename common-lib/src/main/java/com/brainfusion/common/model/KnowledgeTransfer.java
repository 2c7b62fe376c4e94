package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record of one knowledge item being handed from its owner to another brain.
 */
public record KnowledgeTransfer(
    @JsonProperty("transferId") String transferId,
    @JsonProperty("knowledgeId") String knowledgeId,
    @JsonProperty("sourceBrain") String sourceBrain,
    @JsonProperty("targetBrain") String targetBrain,
    @JsonProperty("knowledgeType") KnowledgeType knowledgeType,
    @JsonProperty("transferredAt") Instant transferredAt
) {}
