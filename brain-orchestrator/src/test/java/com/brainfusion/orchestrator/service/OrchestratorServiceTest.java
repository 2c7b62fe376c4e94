package com.brainfusion.orchestrator.service;

import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.BrainKind;
import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.common.model.DecisionRequest;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import com.brainfusion.common.reliability.InMemoryBrainReliabilityRepository;
import com.brainfusion.common.strategy.RecommendationBuilder;
import com.brainfusion.orchestrator.config.BrainFusionProperties;
import com.brainfusion.orchestrator.logger.DecisionFlowLogger;
import com.brainfusion.orchestrator.oracle.BrainRegistry;
import com.brainfusion.orchestrator.oracle.ReasoningOracle;
import com.brainfusion.orchestrator.oracle.StubOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OrchestratorServiceTest {

    private static final String TRACE = "trace-test";

    private static final Map<String, Object> INTENT_CONTENT = Map.of(
        "action_type", "operational",
        "intent_type", "deployment");

    private static final Map<String, Object> PLAN_CONTENT = Map.of(
        "complexity", "medium",
        "steps", List.of("build", "deploy", "verify"),
        "estimated_duration", 120,
        "sme_needs", List.of("database_administration", "cloud_services"));

    private BrainFusionProperties properties;
    private DecisionRegistry decisionRegistry;

    @BeforeEach
    void setUp() {
        properties = new BrainFusionProperties();
        properties.getOrchestration().setApplyReliability(false);
        properties.getOrchestration().setRequestTimeout(Duration.ofSeconds(5));
        decisionRegistry = new DecisionRegistry(100);
    }

    private OrchestratorService service(ReasoningOracle intent, ReasoningOracle technical, ReasoningOracle... smes) {
        BrainRegistry registry = new BrainRegistry(intent, technical, List.of(smes));
        BrainReliabilityTracker tracker = new BrainReliabilityTracker(new InMemoryBrainReliabilityRepository(), registry);
        return new OrchestratorService(registry, tracker, decisionRegistry, new DecisionFlowLogger(), properties);
    }

    private static StubOracle scenarioIntent() {
        return StubOracle.intent(0.9, RiskLevel.LOW, INTENT_CONTENT);
    }

    private static StubOracle scenarioTechnical() {
        return StubOracle.technical(0.85, RiskLevel.LOW, PLAN_CONTENT);
    }

    private static StubOracle database() {
        return StubOracle.sme("database_administration", 0.7, RiskLevel.LOW, List.of("Take a backup first"));
    }

    private static StubOracle cloud() {
        return StubOracle.sme("cloud_services", 0.6, RiskLevel.MEDIUM, List.of());
    }

    // ── fusion ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fusion")
    class Fusion {

        @Test
        @DisplayName("two SMEs, low/low/low/medium risk ⇒ 0.83, medium, guided execution")
        void scenarioA() {
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical(), database(), cloud());

            StepVerifier.create(service.decide(new DecisionRequest("req-a", "deploy the new release", null), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.requestId()).isEqualTo("req-a");
                    assertThat(decision.overallConfidence()).isCloseTo(0.83, within(1e-9));
                    assertThat(decision.riskAssessment().overallRiskLevel()).isEqualTo(RiskLevel.LOW);
                    assertThat(decision.executionStrategy()).isEqualTo(ExecutionStrategy.GUIDED_EXECUTION);
                    assertThat(decision.contributingBrains()).containsExactly(
                        "intent_brain", "technical_brain", "sme_database_administration", "sme_cloud_services");
                    assertThat(decision.metadata().get(AggregatedDecision.META_SME_CONSULTED))
                        .isEqualTo(List.of("database_administration", "cloud_services"));
                    assertThat(decision.recommendedActions())
                        .startsWith("Execute plan with step-by-step validation")
                        .contains("Execute 3 planned steps", "Follow database_administration expert recommendations");
                    assertThat(decision.isDegraded()).isFalse();
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("no SME consulted ⇒ SME component defaults to 0.5")
        void scenarioB() {
            StubOracle technical = StubOracle.technical(0.85, RiskLevel.LOW, Map.of("complexity", "low"));
            OrchestratorService service = service(scenarioIntent(), technical);

            StepVerifier.create(service.decide(DecisionRequest.of("restart the cache"), TRACE))
                .assertNext(decision ->
                    assertThat(decision.overallConfidence()).isCloseTo(0.9 * 0.4 + 0.85 * 0.4 + 0.5 * 0.2, within(1e-9)))
                .verifyComplete();
        }

        @Test
        @DisplayName("reliability scaling lifts SME confidences by the 1.1 SME default")
        void reliabilityApplied() {
            properties.getOrchestration().setApplyReliability(true);
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical(), database(), cloud());

            double expectedSme = (0.7 * 1.1 + 0.6 * 1.1) / 2;
            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .assertNext(decision -> assertThat(decision.overallConfidence())
                    .isCloseTo(0.9 * 0.4 + 0.85 * 0.4 + expectedSme * 0.2, within(1e-9)))
                .verifyComplete();
        }

        @Test
        @DisplayName("informational intent ⇒ informational response")
        void informational() {
            StubOracle intent = StubOracle.intent(0.95, RiskLevel.LOW, Map.of("action_type", "information"));
            StubOracle technical = StubOracle.technical(0.9, RiskLevel.LOW, Map.of());
            OrchestratorService service = service(intent, technical);

            StepVerifier.create(service.decide(DecisionRequest.of("what version is deployed?"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.executionStrategy()).isEqualTo(ExecutionStrategy.INFORMATIONAL_RESPONSE);
                    assertThat(decision.recommendedActions()).isEqualTo(RecommendationBuilder.INFORMATIONAL);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("technical brain receives the intent output as prior output")
        void priorOutputChained() {
            StubOracle technical = scenarioTechnical();
            StubOracle sme = database();
            OrchestratorService service = service(scenarioIntent(), technical, sme);

            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .expectNextCount(1)
                .verifyComplete();

            assertThat(technical.requests()).hasSize(1);
            assertThat(technical.requests().get(0).priorOutput()).isEqualTo(INTENT_CONTENT);
            assertThat(sme.requests().get(0).priorOutput()).isEqualTo(PLAN_CONTENT);
        }
    }

    // ── SME selection ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("SME selection")
    class SmeSelection {

        @Test
        @DisplayName("high intent risk adds the security SME")
        void securityOnHighRisk() {
            StubOracle intent = StubOracle.intent(0.8, RiskLevel.HIGH, INTENT_CONTENT);
            StubOracle technical = StubOracle.technical(0.8, RiskLevel.MEDIUM, Map.of("complexity", "high"));
            StubOracle security = StubOracle.sme("security_and_compliance", 0.9, RiskLevel.HIGH, List.of());
            OrchestratorService service = service(intent, technical, security);

            StepVerifier.create(service.decide(DecisionRequest.of("drop the production table"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.contributingBrains()).contains("sme_security_and_compliance");
                    assertThat(decision.riskAssessment().overallRiskLevel()).isEqualTo(RiskLevel.HIGH);
                })
                .verifyComplete();
            assertThat(security.requests()).hasSize(1);
        }

        @Test
        @DisplayName("planned domains without a registered SME are skipped")
        void unregisteredSkipped() {
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical(), database());

            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.metadata().get(AggregatedDecision.META_SME_CONSULTED))
                        .isEqualTo(List.of("database_administration"));
                    assertThat(decision.metadata().get(AggregatedDecision.META_SME_FAILED)).isEqualTo(List.of());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a failed SME is recorded and excluded from averaging")
        void smeFailure() {
            ReasoningOracle failingCloud = StubOracle.failing(BrainDescriptor.sme("cloud_services"), "connection refused");
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical(), database(), failingCloud);

            StepVerifier.create(service.decide(new DecisionRequest("req-f", "deploy", null), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.overallConfidence()).isCloseTo(0.9 * 0.4 + 0.85 * 0.4 + 0.7 * 0.2, within(1e-9));
                    assertThat(decision.metadata().get(AggregatedDecision.META_SME_FAILED))
                        .isEqualTo(List.of("cloud_services"));
                    assertThat(decision.contributingBrains()).doesNotContain("sme_cloud_services");
                    assertThat(decision.isDegraded()).isFalse();
                })
                .verifyComplete();

            DecisionRecord record = decisionRegistry.find("req-f").orElseThrow();
            assertThat(record.smeConsultations()).hasSize(2);
            assertThat(record.smeConsultations().get(1)).isInstanceOf(SmeConsultation.Failed.class);
        }

        @Test
        @DisplayName("a prose SME answer counts as 0.5 confidence")
        void freeTextSme() {
            ReasoningOracle prose = StubOracle.freeText("database_administration", "Looks fine, take a backup.");
            StubOracle technical = StubOracle.technical(0.85, RiskLevel.LOW,
                Map.of("sme_needs", List.of("database_administration")));
            OrchestratorService service = service(scenarioIntent(), technical, prose);

            StepVerifier.create(service.decide(DecisionRequest.of("migrate schema"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.overallConfidence()).isCloseTo(0.9 * 0.4 + 0.85 * 0.4 + 0.5 * 0.2, within(1e-9));
                    assertThat(decision.contributingBrains()).contains("sme_database_administration");
                })
                .verifyComplete();
        }
    }

    // ── degradation ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("degradation")
    class Degradation {

        @Test
        @DisplayName("intent failure ⇒ minimal decision, never an error signal")
        void intentFailure() {
            ReasoningOracle intent = StubOracle.failing(
                BrainDescriptor.of(BrainDescriptor.INTENT_BRAIN_ID, BrainKind.INTENT), "model offline");
            OrchestratorService service = service(intent, scenarioTechnical());

            StepVerifier.create(service.decide(new DecisionRequest("req-e", "deploy", null), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.overallConfidence()).isZero();
                    assertThat(decision.executionStrategy()).isEqualTo(ExecutionStrategy.MANUAL_REVIEW);
                    assertThat(decision.riskAssessment().overallRiskLevel()).isEqualTo(RiskLevel.HIGH);
                    assertThat(decision.riskAssessment().error()).contains("model offline");
                    assertThat(decision.recommendedActions()).isEqualTo(RecommendationBuilder.DEGRADED);
                    assertThat(decision.contributingBrains()).isEmpty();
                    assertThat(decision.isDegraded()).isTrue();
                })
                .verifyComplete();

            assertThat(decisionRegistry.find("req-e")).isPresent();
        }

        @Test
        @DisplayName("technical failure keeps the intent brain as contributor")
        void technicalFailure() {
            ReasoningOracle technical = StubOracle.failing(
                BrainDescriptor.of(BrainDescriptor.TECHNICAL_BRAIN_ID, BrainKind.TECHNICAL), "planner crashed");
            OrchestratorService service = service(scenarioIntent(), technical);

            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.isDegraded()).isTrue();
                    assertThat(decision.contributingBrains()).containsExactly("intent_brain");
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("budget expiry before the plan ⇒ manual review with a timeout marker")
        void timeoutBeforePlan() {
            properties.getOrchestration().setRequestTimeout(Duration.ofMillis(200));
            StubOracle technical = StubOracle.slow(scenarioTechnical(), Duration.ofSeconds(5));
            OrchestratorService service = service(scenarioIntent(), technical);

            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.executionStrategy()).isEqualTo(ExecutionStrategy.MANUAL_REVIEW);
                    assertThat(decision.metadata()).containsEntry(AggregatedDecision.META_TIMED_OUT, true);
                    assertThat(decision.contributingBrains()).containsExactly("intent_brain");
                    assertThat(decision.riskAssessment().error()).contains("timed out");
                })
                .expectComplete()
                .verify(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("budget expiry during SME fan-out still uses intent and plan")
        void timeoutDuringSmes() {
            properties.getOrchestration().setRequestTimeout(Duration.ofMillis(200));
            StubOracle slowDatabase = StubOracle.slow(database(), Duration.ofSeconds(5));
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical(), slowDatabase);

            StepVerifier.create(service.decide(DecisionRequest.of("deploy"), TRACE))
                .assertNext(decision -> {
                    assertThat(decision.executionStrategy()).isEqualTo(ExecutionStrategy.MANUAL_REVIEW);
                    assertThat(decision.overallConfidence()).isCloseTo(0.9 * 0.4 + 0.85 * 0.4 + 0.5 * 0.2, within(1e-9));
                    assertThat(decision.contributingBrains()).containsExactly("intent_brain", "technical_brain");
                    assertThat(decision.metadata()).containsEntry(AggregatedDecision.META_TIMED_OUT, true);
                    assertThat(decision.riskAssessment().error()).contains("timed out");
                    assertThat(decision.riskAssessment().overallRiskLevel()).isEqualTo(RiskLevel.LOW);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(3));
        }

        @Test
        @DisplayName("blank request text is rejected")
        void blankText() {
            OrchestratorService service = service(scenarioIntent(), scenarioTechnical());

            StepVerifier.create(service.decide(DecisionRequest.of("  "), TRACE))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }
}
