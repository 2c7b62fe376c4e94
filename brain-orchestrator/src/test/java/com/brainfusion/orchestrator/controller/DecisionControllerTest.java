package com.brainfusion.orchestrator.controller;

import com.brainfusion.common.exception.RequestNotFoundException;
import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.common.model.DecisionRequest;
import com.brainfusion.common.model.ExecutionFeedback;
import com.brainfusion.common.model.ExecutionOutcome;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskAssessment;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.trace.TraceContextUtil;
import com.brainfusion.orchestrator.service.DecisionRegistry;
import com.brainfusion.orchestrator.service.FeedbackResult;
import com.brainfusion.orchestrator.service.LearningService;
import com.brainfusion.orchestrator.service.OrchestratorService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = DecisionController.class)
class DecisionControllerTest {

    @Autowired
    private WebTestClient client;

    @MockBean
    private OrchestratorService orchestratorService;

    @MockBean
    private LearningService learningService;

    @MockBean
    private DecisionRegistry decisionRegistry;

    private static AggregatedDecision decision(String requestId) {
        return new AggregatedDecision(requestId, 0.83, ExecutionStrategy.GUIDED_EXECUTION,
            new RiskAssessment(RiskLevel.MEDIUM, List.of("downtime"), Map.of(), List.of(), null),
            List.of("Execute plan with step-by-step validation"), List.of("intent_brain", "technical_brain"),
            25, Map.of(), null);
    }

    // ── POST /api/v1/decisions ───────────────────────────────────────────────

    @Test
    @DisplayName("decide returns the decision and echoes the trace id")
    void decide() {
        when(orchestratorService.decide(any(DecisionRequest.class), eq("trace-42")))
            .thenReturn(Mono.just(decision("req-1")));

        client.post().uri("/api/v1/decisions")
            .header(TraceContextUtil.TRACE_ID_HEADER, "trace-42")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("requestId", "req-1", "text", "Deploy the payment service"))
            .exchange()
            .expectStatus().isOk()
            .expectHeader().valueEquals(TraceContextUtil.TRACE_ID_HEADER, "trace-42")
            .expectBody()
            .jsonPath("$.requestId").isEqualTo("req-1")
            .jsonPath("$.executionStrategy").isEqualTo("guided_execution")
            .jsonPath("$.riskAssessment.overallRiskLevel").isEqualTo("medium")
            .jsonPath("$.riskAssessment.error").doesNotExist()
            .jsonPath("$.contributingBrains.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("blank request text ⇒ 400")
    void decideBlank() {
        when(orchestratorService.decide(any(DecisionRequest.class), anyString()))
            .thenReturn(Mono.error(new IllegalArgumentException("Decision request text is required")));

        client.post().uri("/api/v1/decisions")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("text", " "))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.status").isEqualTo(400)
            .jsonPath("$.message").isEqualTo("Decision request text is required");
    }

    // ── GET /api/v1/decisions/{id} ───────────────────────────────────────────

    @Test
    @DisplayName("a registered decision can be fetched again")
    void find() {
        when(decisionRegistry.find("req-1"))
            .thenReturn(Optional.of(new DecisionRecord(decision("req-1"), null, null, List.of(), "t")));

        client.get().uri("/api/v1/decisions/req-1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.overallConfidence").isEqualTo(0.83);
    }

    @Test
    @DisplayName("unknown decision ⇒ 404")
    void findUnknown() {
        when(decisionRegistry.find("missing")).thenReturn(Optional.empty());

        client.get().uri("/api/v1/decisions/missing")
            .exchange()
            .expectStatus().isNotFound()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Not Found");
    }

    // ── POST /api/v1/decisions/{id}/feedback ─────────────────────────────────

    @Test
    @DisplayName("feedback reports what the learning loop did with it")
    void feedback() {
        when(learningService.submitFeedback(eq("req-1"), any(ExecutionFeedback.class), anyString()))
            .thenReturn(Mono.just(new FeedbackResult("req-1", 2, 2, 0, 0, List.of())));

        client.post().uri("/api/v1/decisions/req-1/feedback")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "success"))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.generated").isEqualTo(2)
            .jsonPath("$.applied").isEqualTo(2);
    }

    @Test
    @DisplayName("lowercase outcome values reach the learning loop")
    void feedbackLowercaseOutcome() {
        when(learningService.submitFeedback(eq("req-1"), any(ExecutionFeedback.class), anyString()))
            .thenReturn(Mono.just(new FeedbackResult("req-1", 2, 2, 0, 0, List.of())));

        client.post().uri("/api/v1/decisions/req-1/feedback")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "partial_success", "confidenceAccuracy", 0.7))
            .exchange()
            .expectStatus().isOk();

        verify(learningService).submitFeedback(eq("req-1"),
            argThat(feedback -> feedback.outcome() == ExecutionOutcome.PARTIAL_SUCCESS), anyString());
    }

    @Test
    @DisplayName("unknown outcome ⇒ 400")
    void feedbackUnknownOutcome() {
        client.post().uri("/api/v1/decisions/req-1/feedback")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "mostly_fine"))
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("feedback for an unknown decision ⇒ 404")
    void feedbackUnknown() {
        when(learningService.submitFeedback(eq("gone"), any(ExecutionFeedback.class), anyString()))
            .thenReturn(Mono.error(new RequestNotFoundException("gone")));

        client.post().uri("/api/v1/decisions/gone/feedback")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("outcome", "failure"))
            .exchange()
            .expectStatus().isNotFound();
    }
}
