package com.brainfusion.orchestrator.oracle;

import com.brainfusion.common.exception.AnalysisUnavailableException;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.RiskLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OracleResponseDecoderTest {

    private final OracleResponseDecoder decoder = new OracleResponseDecoder(new ObjectMapper());

    @Test
    @DisplayName("nested content, snake_case risk and recommendations are read")
    void nestedShape() {
        BrainAnalysis a = decoder.decode("intent_brain", """
            {"confidence": 0.9, "risk_level": "low",
             "content": {"intent_type": "deployment", "action_type": "operational"},
             "recommendations": ["check quota"]}
            """);

        assertThat(a.brainId()).isEqualTo("intent_brain");
        assertThat(a.confidence()).isEqualTo(0.9);
        assertThat(a.riskLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(a.intentType()).isEqualTo("deployment");
        assertThat(a.recommendations()).containsExactly("check quota");
    }

    @Test
    @DisplayName("flat replies keep the non-reserved fields as content")
    void flatShape() {
        BrainAnalysis a = decoder.decode("technical_brain", """
            {"confidence": 0.7, "riskLevel": "HIGH", "complexity": "high", "sme_needs": ["cloud_services"]}
            """);

        assertThat(a.riskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(a.content()).containsOnlyKeys("complexity", "sme_needs");
        assertThat(a.smeNeeds()).containsExactly("cloud_services");
    }

    @Test
    @DisplayName("missing confidence reads 0.5, out-of-range is clamped, unknown risk is medium")
    void lenientValues() {
        assertThat(decoder.decode("b", "{\"risk_level\": \"catastrophic\"}"))
            .satisfies(a -> {
                assertThat(a.confidence()).isEqualTo(0.5);
                assertThat(a.riskLevel()).isEqualTo(RiskLevel.MEDIUM);
            });
        assertThat(decoder.decode("b", "{\"confidence\": 1.7}").confidence()).isEqualTo(1.0);
        assertThat(decoder.decode("b", "{\"confidence\": -2}").confidence()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("prose, arrays and blanks are not analyses")
    void notAnObject() {
        assertThatThrownBy(() -> decoder.decode("b", "Use TLS everywhere."))
            .isInstanceOf(AnalysisUnavailableException.class);
        assertThatThrownBy(() -> decoder.decode("b", "[1, 2]"))
            .isInstanceOf(AnalysisUnavailableException.class);
        assertThat(decoder.parseObject("  ")).isEmpty();
    }
}
