package com.brainfusion.orchestrator.oracle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body posted to a reasoning brain. {@code priorOutput} carries the upstream brain's
 * content (Intent output for the Technical brain, the Technical plan for SMEs).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainRequest(
    @JsonProperty("text") String text,
    @JsonProperty("context") Map<String, Object> context,
    @JsonProperty("prior_output") Map<String, Object> priorOutput
) {
    public BrainRequest {
        context = context == null ? Map.of() : context;
    }

    public static BrainRequest of(String text, Map<String, Object> context) {
        return new BrainRequest(text, context, null);
    }

    public BrainRequest withPriorOutput(Map<String, Object> prior) {
        return new BrainRequest(text, context, prior);
    }
}
