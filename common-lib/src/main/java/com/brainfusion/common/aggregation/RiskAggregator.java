package com.brainfusion.common.aggregation;

import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.RiskAssessment;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the risk views of every brain into one {@link RiskAssessment}.
 *
 * <ul>
 *   <li>overall level: max severity over intent, technical and structured SME answers</li>
 *   <li>risk factors: union in first-seen order (intent, technical, then SMEs)</li>
 *   <li>mitigation strategies: SME strategies flattened in consultation order</li>
 * </ul>
 *
 * Free-text and failed consultations carry no risk information and are skipped.
 */
public final class RiskAggregator {

    private RiskAggregator() {}

    public static RiskAssessment aggregate(BrainAnalysis intent, BrainAnalysis technical,
                                           List<SmeConsultation> consultations) {
        RiskLevel overall = RiskLevel.max(intent.riskLevel(), technical.riskLevel());

        Set<String> factors = new LinkedHashSet<>(intent.riskFactors());
        factors.addAll(technical.riskFactors());

        Map<String, RiskLevel> smeRisks = new LinkedHashMap<>();
        List<String> mitigations = new ArrayList<>();

        for (SmeConsultation consultation : consultations == null ? List.<SmeConsultation>of() : consultations) {
            if (!(consultation instanceof SmeConsultation.Structured structured)) {
                continue;
            }
            BrainAnalysis sme = structured.analysis();
            overall = RiskLevel.max(overall, sme.riskLevel());
            smeRisks.put(structured.domain(), sme.riskLevel());
            factors.addAll(sme.riskFactors());
            mitigations.addAll(sme.mitigationStrategies());
        }

        return new RiskAssessment(overall, new ArrayList<>(factors), smeRisks, mitigations, null);
    }
}
