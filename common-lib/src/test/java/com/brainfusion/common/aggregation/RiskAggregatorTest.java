package com.brainfusion.common.aggregation;

import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.RiskAssessment;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RiskAggregatorTest {

    private static BrainAnalysis analysis(String id, RiskLevel risk, Map<String, Object> content) {
        return BrainAnalysis.of(id, 0.8, risk, content);
    }

    @Test
    @DisplayName("overall level is the max severity across intent, technical and SMEs")
    void maxSeverity() {
        List<SmeConsultation> smes = List.of(
            new SmeConsultation.Structured("security", analysis("sme_security", RiskLevel.LOW, Map.of())),
            new SmeConsultation.Structured("database", analysis("sme_database", RiskLevel.MEDIUM, Map.of())));
        RiskAssessment result = RiskAggregator.aggregate(
            analysis("intent_brain", RiskLevel.LOW, Map.of()),
            analysis("technical_brain", RiskLevel.LOW, Map.of()), smes);

        assertEquals(RiskLevel.MEDIUM, result.overallRiskLevel());
        assertEquals(Map.of("security", RiskLevel.LOW, "database", RiskLevel.MEDIUM), result.smeRisks());
        assertFalse(result.hasError());
    }

    @Test
    @DisplayName("risk factors are de-duplicated in first-seen order, mitigations flattened")
    void factorsAndMitigations() {
        BrainAnalysis intent = analysis("intent_brain", RiskLevel.LOW,
            Map.of(BrainAnalysis.RISK_FACTORS, List.of("downtime", "data loss")));
        BrainAnalysis technical = analysis("technical_brain", RiskLevel.HIGH,
            Map.of(BrainAnalysis.RISK_FACTORS, List.of("data loss", "lock contention")));
        SmeConsultation sme = new SmeConsultation.Structured("database", analysis("sme_database", RiskLevel.LOW,
            Map.of(BrainAnalysis.RISK_FACTORS, List.of("replication lag"),
                   BrainAnalysis.MITIGATION_STRATEGIES, List.of("take snapshot", "run off-peak"))));

        RiskAssessment result = RiskAggregator.aggregate(intent, technical, List.of(sme));

        assertEquals(RiskLevel.HIGH, result.overallRiskLevel());
        assertEquals(List.of("downtime", "data loss", "lock contention", "replication lag"), result.riskFactors());
        assertEquals(List.of("take snapshot", "run off-peak"), result.mitigationStrategies());
    }

    @Test
    @DisplayName("free-text and failed consultations carry no risk information")
    void nonStructuredIgnored() {
        RiskAssessment result = RiskAggregator.aggregate(
            analysis("intent_brain", RiskLevel.LOW, Map.of()),
            analysis("technical_brain", RiskLevel.LOW, Map.of()),
            List.of(new SmeConsultation.FreeText("network", "high risk!"),
                    new SmeConsultation.Failed("security", "timeout")));

        assertEquals(RiskLevel.LOW, result.overallRiskLevel());
        assertTrue(result.smeRisks().isEmpty());
    }
}
