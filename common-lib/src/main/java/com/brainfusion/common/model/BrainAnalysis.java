package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output every reasoning brain hands back to the orchestrator.
 *
 * <p>{@code content} is opaque to the pipeline except for the well-known keys exposed
 * through the typed accessors below ({@code action_type}, {@code intent_type},
 * {@code complexity}, {@code risk_factors}, {@code sme_needs}, {@code steps},
 * {@code estimated_duration}, {@code mitigation_strategies}).
 */
public record BrainAnalysis(
    @JsonProperty("brainId") String brainId,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("riskLevel") RiskLevel riskLevel,
    @JsonProperty("content") Map<String, Object> content,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("timestamp") Instant timestamp
) {
    public static final String ACTION_TYPE           = "action_type";
    public static final String INTENT_TYPE           = "intent_type";
    public static final String COMPLEXITY            = "complexity";
    public static final String RISK_FACTORS          = "risk_factors";
    public static final String SME_NEEDS             = "sme_needs";
    public static final String STEPS                 = "steps";
    public static final String ESTIMATED_DURATION    = "estimated_duration";
    public static final String MITIGATION_STRATEGIES = "mitigation_strategies";

    public BrainAnalysis {
        riskLevel       = riskLevel == null ? RiskLevel.MEDIUM : riskLevel;
        content         = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        timestamp       = timestamp == null ? Instant.now() : timestamp;
    }

    public static BrainAnalysis of(String brainId, double confidence, RiskLevel riskLevel,
                                   Map<String, Object> content) {
        return new BrainAnalysis(brainId, confidence, riskLevel, content, List.of(), Instant.now());
    }

    @JsonIgnore
    public ActionType actionType() {
        return ActionType.fromValue(stringValue(ACTION_TYPE, null));
    }

    @JsonIgnore
    public String intentType() {
        return stringValue(INTENT_TYPE, "unknown");
    }

    @JsonIgnore
    public String complexity() {
        return stringValue(COMPLEXITY, "unknown");
    }

    @JsonIgnore
    public List<String> riskFactors() {
        return stringList(RISK_FACTORS);
    }

    @JsonIgnore
    public List<String> smeNeeds() {
        return stringList(SME_NEEDS);
    }

    @JsonIgnore
    public List<String> mitigationStrategies() {
        return stringList(MITIGATION_STRATEGIES);
    }

    /** Number of planned steps; accepts either a list of steps or a bare count. */
    @JsonIgnore
    public int stepCount() {
        Object steps = content.get(STEPS);
        if (steps instanceof Collection<?> c) return c.size();
        if (steps instanceof Number n) return n.intValue();
        return 0;
    }

    /** Estimated duration in seconds, 0 when absent. */
    @JsonIgnore
    public double estimatedDurationSeconds() {
        Object duration = content.get(ESTIMATED_DURATION);
        if (duration instanceof Number n) return n.doubleValue();
        if (duration instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private String stringValue(String key, String fallback) {
        Object value = content.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    private List<String> stringList(String key) {
        Object value = content.get(key);
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<String> out = new ArrayList<>(items.size());
        for (Object item : items) {
            if (item != null) out.add(String.valueOf(item));
        }
        return out;
    }
}
