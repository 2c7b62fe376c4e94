package com.brainfusion.common.strategy;

import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the ordered recommendation list for a decision.
 *
 * <p>Order: strategy guidance, step and duration notes from the technical plan,
 * one note per SME that returned recommendations, then risk-mitigation notes when the
 * technical plan itself is high risk. Capped at {@value AggregatedDecision#MAX_RECOMMENDED_ACTIONS}.
 * An informational response gets the two fixed informational lines only.
 */
public final class RecommendationBuilder {

    static final double MAINTENANCE_WINDOW_SECONDS = 300.0;

    public static final List<String> INFORMATIONAL = List.of(
        "Information provided based on available data",
        "No further action required");

    public static final List<String> DEGRADED = List.of("Review error and retry");

    private RecommendationBuilder() {}

    public static List<String> build(ExecutionStrategy strategy, BrainAnalysis technical,
                                     List<SmeConsultation> consultations) {
        if (strategy == ExecutionStrategy.INFORMATIONAL_RESPONSE) {
            return INFORMATIONAL;
        }

        List<String> out = new ArrayList<>(strategyGuidance(strategy));

        int steps = technical.stepCount();
        if (steps > 0) {
            out.add("Execute " + steps + " planned steps");
            if (technical.estimatedDurationSeconds() > MAINTENANCE_WINDOW_SECONDS) {
                out.add("Consider scheduling during maintenance window");
            }
        }

        for (SmeConsultation consultation : consultations) {
            if (consultation instanceof SmeConsultation.Structured structured
                    && !structured.analysis().recommendations().isEmpty()) {
                out.add("Follow " + structured.domain() + " expert recommendations");
            }
        }

        if (technical.riskLevel() == RiskLevel.HIGH) {
            out.add("Implement additional safety measures");
            out.add("Prepare rollback procedures");
        }

        return out.size() > AggregatedDecision.MAX_RECOMMENDED_ACTIONS
            ? List.copyOf(out.subList(0, AggregatedDecision.MAX_RECOMMENDED_ACTIONS))
            : List.copyOf(out);
    }

    static List<String> strategyGuidance(ExecutionStrategy strategy) {
        return switch (strategy) {
            case AUTOMATED_EXECUTION -> List.of(
                "Execute plan automatically with monitoring",
                "Set up automated rollback on failure");
            case GUIDED_EXECUTION -> List.of(
                "Execute plan with step-by-step validation",
                "Require approval for high-risk steps");
            case MANUAL_REVIEW -> List.of(
                "Manual review required before execution",
                "Consider breaking down into smaller steps");
            case ASSISTED_EXECUTION -> List.of(
                "Review the analysis and proceed with appropriate action",
                "Validate each step before proceeding");
            case INFORMATIONAL_RESPONSE -> INFORMATIONAL;
        };
    }
}
