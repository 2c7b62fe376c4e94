package com.brainfusion.orchestrator.controller;

import com.brainfusion.common.exception.RequestNotFoundException;
import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.DecisionRequest;
import com.brainfusion.common.model.ExecutionFeedback;
import com.brainfusion.common.trace.TraceContextUtil;
import com.brainfusion.orchestrator.service.DecisionRegistry;
import com.brainfusion.orchestrator.service.FeedbackResult;
import com.brainfusion.orchestrator.service.LearningService;
import com.brainfusion.orchestrator.service.OrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionController {

    private final OrchestratorService orchestratorService;
    private final LearningService learningService;
    private final DecisionRegistry decisionRegistry;

    public DecisionController(OrchestratorService orchestratorService, LearningService learningService,
                              DecisionRegistry decisionRegistry) {
        this.orchestratorService = orchestratorService;
        this.learningService     = learningService;
        this.decisionRegistry    = decisionRegistry;
    }

    @PostMapping
    public Mono<ResponseEntity<AggregatedDecision>> decide(
            @RequestBody DecisionRequest request,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        String traceId = TraceContextUtil.resolve(traceIdHeader);
        return orchestratorService.decide(request, traceId)
            .map(decision -> ResponseEntity.ok()
                .header(TraceContextUtil.TRACE_ID_HEADER, traceId)
                .body(decision));
    }

    @GetMapping("/{requestId}")
    public Mono<ResponseEntity<AggregatedDecision>> find(@PathVariable String requestId) {
        return Mono.fromCallable(() -> decisionRegistry.find(requestId)
                .orElseThrow(() -> new RequestNotFoundException(requestId)))
            .map(record -> ResponseEntity.ok(record.decision()));
    }

    @PostMapping("/{requestId}/feedback")
    public Mono<ResponseEntity<FeedbackResult>> feedback(
            @PathVariable String requestId,
            @RequestBody ExecutionFeedback feedback,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        return learningService.submitFeedback(requestId, feedback, TraceContextUtil.resolve(traceIdHeader))
            .map(ResponseEntity::ok);
    }
}
