package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.exception.AnalysisUnavailableException;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.RiskLevel;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a brain's raw reply into a {@link BrainAnalysis}.
 *
 * <p>Accepted shapes: {@code {confidence, risk_level|riskLevel, content, recommendations}}
 * or a flat object whose non-reserved fields are taken as the content. Confidence is
 * clamped to [0,1]; a missing or unknown risk level reads as medium.
 */
public class OracleResponseDecoder {

    private static final Set<String> RESERVED = Set.of(
        "brain_id", "brainId", "confidence", "risk_level", "riskLevel", "content",
        "recommendations", "timestamp");

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public OracleResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws AnalysisUnavailableException when {@code raw} is not a JSON object
     */
    public BrainAnalysis decode(String brainId, String raw) {
        return parseObject(raw)
            .map(node -> toAnalysis(brainId, node))
            .orElseThrow(() -> new AnalysisUnavailableException(brainId, "Reply is not a JSON object"));
    }

    /** The reply as a JSON object, empty when it is prose or malformed. */
    public Optional<ObjectNode> parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node instanceof ObjectNode object ? Optional.of(object) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public BrainAnalysis toAnalysis(String brainId, ObjectNode node) {
        double confidence = clamp(node.path("confidence").asDouble(0.5));
        JsonNode riskNode = node.has("risk_level") ? node.get("risk_level") : node.path("riskLevel");
        RiskLevel risk = RiskLevel.fromValue(riskNode.asText(null));

        Map<String, Object> content;
        if (node.path("content").isObject()) {
            content = objectMapper.convertValue(node.get("content"), MAP_TYPE);
        } else {
            content = new LinkedHashMap<>();
            ObjectNode rest = node.deepCopy();
            rest.remove(RESERVED);
            content.putAll(objectMapper.convertValue(rest, MAP_TYPE));
        }

        List<String> recommendations = new ArrayList<>();
        node.path("recommendations").forEach(r -> recommendations.add(r.asText()));

        return new BrainAnalysis(brainId, confidence, risk, content, recommendations, Instant.now());
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
