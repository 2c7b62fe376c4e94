package com.brainfusion.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Merged risk verdict across intent, technical and SME brains.
 *
 * <p>{@code error} is only populated for degraded decisions (mandatory brain failure or
 * request timeout); its presence is the caller-visible degradation signal.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RiskAssessment(
    @JsonProperty("overallRiskLevel") RiskLevel overallRiskLevel,
    @JsonProperty("riskFactors") List<String> riskFactors,
    @JsonProperty("smeRisks") Map<String, RiskLevel> smeRisks,
    @JsonProperty("mitigationStrategies") List<String> mitigationStrategies,
    @JsonProperty("error") String error
) {
    public RiskAssessment {
        riskFactors          = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        smeRisks             = smeRisks == null ? Map.of() : Map.copyOf(smeRisks);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
    }

    public static RiskAssessment error(String message) {
        return new RiskAssessment(RiskLevel.HIGH, List.of(), Map.of(), List.of(), message);
    }

    public boolean hasError() {
        return error != null;
    }

    public RiskAssessment withError(String message) {
        return new RiskAssessment(RiskLevel.HIGH, riskFactors, smeRisks, mitigationStrategies, message);
    }
}
