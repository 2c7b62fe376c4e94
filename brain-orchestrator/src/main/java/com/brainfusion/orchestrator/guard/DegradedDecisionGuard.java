package com.brainfusion.orchestrator.guard;

import com.brainfusion.common.aggregation.ConfidenceAggregator;
import com.brainfusion.common.aggregation.RiskAggregator;
import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskAssessment;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.strategy.RecommendationBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the decisions returned when the pipeline cannot finish normally.
 *
 * <p>Both variants route to {@link ExecutionStrategy#MANUAL_REVIEW} and are never
 * {@code null}. Pure utility: no reactive types, no logging, no state.
 */
public final class DegradedDecisionGuard {

    private DegradedDecisionGuard() {}

    /**
     * Minimal decision after an Intent or Technical failure: confidence 0, high risk with
     * the failure in {@code riskAssessment.error}.
     */
    public static AggregatedDecision errorDecision(String requestId, String message,
                                                   List<String> contributingBrains, long processingTimeMs) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AggregatedDecision.META_DEGRADED, true);
        return new AggregatedDecision(requestId, 0.0, ExecutionStrategy.MANUAL_REVIEW,
            RiskAssessment.error(message == null ? "Unknown error" : message),
            RecommendationBuilder.DEGRADED, contributingBrains, processingTimeMs, metadata, Instant.now());
    }

    /**
     * Decision after the request budget expired. Whatever Intent/Technical results were
     * already obtained still feed confidence and risk; SME results are dropped. A missing
     * Technical plan contributes zero confidence. Every variant carries the timeout marker
     * in {@code riskAssessment.error}.
     *
     * @param intent      Intent result, {@code null} if it never arrived
     * @param technical   Technical result, {@code null} if it never arrived
     * @param reliability per-brain multipliers, empty to disable scaling
     */
    public static AggregatedDecision timeoutDecision(String requestId, BrainAnalysis intent, BrainAnalysis technical,
                                                     Map<String, Double> reliability, Duration budget,
                                                     long processingTimeMs) {
        String marker = "Decision timed out after " + budget.toMillis() + "ms";
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AggregatedDecision.META_TIMED_OUT, true);

        if (intent == null) {
            metadata.put(AggregatedDecision.META_DEGRADED, true);
            return new AggregatedDecision(requestId, 0.0, ExecutionStrategy.MANUAL_REVIEW,
                RiskAssessment.error(marker), RecommendationBuilder.DEGRADED, List.of(),
                processingTimeMs, metadata, Instant.now());
        }

        List<String> contributing = new ArrayList<>();
        contributing.add(intent.brainId());

        if (technical == null) {
            double scaled = intent.confidence() * reliability.getOrDefault(intent.brainId(), 1.0);
            double confidence = ConfidenceAggregator.aggregate(scaled, 0.0, List.of());
            RiskAssessment risk = new RiskAssessment(RiskLevel.max(intent.riskLevel(), RiskLevel.MEDIUM),
                intent.riskFactors(), Map.of(), intent.mitigationStrategies(), marker);
            metadata.put(AggregatedDecision.META_DEGRADED, true);
            return new AggregatedDecision(requestId, confidence, ExecutionStrategy.MANUAL_REVIEW, risk,
                RecommendationBuilder.DEGRADED, contributing, processingTimeMs, metadata, Instant.now());
        }

        contributing.add(technical.brainId());
        double confidence = ConfidenceAggregator.aggregate(intent, technical, List.of(), reliability);
        RiskAssessment fused = RiskAggregator.aggregate(intent, technical, List.of());
        RiskAssessment risk = new RiskAssessment(fused.overallRiskLevel(), fused.riskFactors(), fused.smeRisks(),
            fused.mitigationStrategies(), marker);
        metadata.put(AggregatedDecision.META_DEGRADED, true);
        return new AggregatedDecision(requestId, confidence, ExecutionStrategy.MANUAL_REVIEW, risk,
            RecommendationBuilder.build(ExecutionStrategy.MANUAL_REVIEW, technical, List.of()),
            contributing, processingTimeMs, metadata, Instant.now());
    }
}
