package com.brainfusion.common.learning;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * External knowledge payload: the feed kind, the name of the publisher, its reliability
 * in [0,1] and the raw content holding the feed's item list.
 */
public record ExternalKnowledgeSubmission(
    @JsonProperty("sourceType") ExternalKnowledgeSource sourceType,
    @JsonProperty("source") String source,
    @JsonProperty("reliability") Double reliability,
    @JsonProperty("content") Map<String, Object> content
) {}
