package com.brainfusion.orchestrator.controller;

import com.brainfusion.common.learning.ExternalKnowledgeSubmission;
import com.brainfusion.common.learning.LearningMetrics;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.quality.QualityMetrics;
import com.brainfusion.common.quality.ValidationSummary;
import com.brainfusion.common.trace.TraceContextUtil;
import com.brainfusion.orchestrator.service.FeedbackResult;
import com.brainfusion.orchestrator.service.LearningService;
import com.brainfusion.orchestrator.service.PendingReview;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/learning")
public class LearningController {

    private final LearningService learningService;

    public LearningController(LearningService learningService) {
        this.learningService = learningService;
    }

    @PostMapping("/external-knowledge")
    public Mono<ResponseEntity<FeedbackResult>> integrate(
            @RequestBody ExternalKnowledgeSubmission submission,
            @RequestHeader(value = TraceContextUtil.TRACE_ID_HEADER, required = false) String traceIdHeader) {
        return learningService.integrateExternalKnowledge(submission, TraceContextUtil.resolve(traceIdHeader))
            .map(ResponseEntity::ok);
    }

    @GetMapping("/metrics")
    public Mono<ResponseEntity<LearningMetrics>> metrics() {
        return Mono.fromCallable(learningService::learningMetrics).map(ResponseEntity::ok);
    }

    @GetMapping("/updates")
    public Mono<ResponseEntity<List<LearningUpdate>>> updates(@RequestParam(defaultValue = "50") int limit) {
        return Mono.fromCallable(() -> learningService.recentUpdates(limit)).map(ResponseEntity::ok);
    }

    // ── manual review ────────────────────────────────────────────────────────

    @GetMapping("/reviews")
    public Mono<ResponseEntity<List<PendingReview>>> reviews() {
        return Mono.fromCallable(learningService::pendingReviews).map(ResponseEntity::ok);
    }

    @PostMapping("/reviews/{updateId}/approve")
    public Mono<ResponseEntity<Map<String, String>>> approve(@PathVariable String updateId) {
        return Mono.fromCallable(() -> learningService.approve(updateId))
            .map(target -> ResponseEntity.ok(Map.of(
                "updateId", updateId, "status", "approved", "appliedTo", target.name())));
    }

    @PostMapping("/reviews/{updateId}/dismiss")
    public Mono<ResponseEntity<Map<String, String>>> dismiss(@PathVariable String updateId) {
        return Mono.fromCallable(() -> learningService.dismiss(updateId))
            .map(review -> ResponseEntity.ok(Map.of("updateId", updateId, "status", "dismissed")));
    }

    // ── reliability & quality ────────────────────────────────────────────────

    @GetMapping("/reliability")
    public Mono<ResponseEntity<Map<String, Double>>> reliability() {
        return Mono.fromCallable(learningService::reliability).map(ResponseEntity::ok);
    }

    @GetMapping("/quality/metrics")
    public Mono<ResponseEntity<QualityMetrics>> qualityMetrics() {
        return Mono.fromCallable(learningService::qualityMetrics).map(ResponseEntity::ok);
    }

    @GetMapping("/quality/validations")
    public Mono<ResponseEntity<List<ValidationSummary>>> validations(@RequestParam(defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> learningService.recentValidations(limit)).map(ResponseEntity::ok);
    }

    // ── source management ────────────────────────────────────────────────────

    @GetMapping("/sources")
    public Mono<ResponseEntity<Map<String, List<String>>>> sources() {
        return Mono.fromCallable(learningService::sources).map(ResponseEntity::ok);
    }

    @PostMapping("/sources/trusted/{source}")
    public Mono<ResponseEntity<Map<String, List<String>>>> trust(@PathVariable String source) {
        return Mono.fromCallable(() -> {
            learningService.trustSource(source);
            return learningService.sources();
        }).map(ResponseEntity::ok);
    }

    @PostMapping("/sources/blacklisted/{source}")
    public Mono<ResponseEntity<Map<String, List<String>>>> blacklist(@PathVariable String source) {
        return Mono.fromCallable(() -> {
            learningService.blacklistSource(source);
            return learningService.sources();
        }).map(ResponseEntity::ok);
    }

    @DeleteMapping("/sources/blacklisted/{source}")
    public Mono<ResponseEntity<Map<String, List<String>>>> unblacklist(@PathVariable String source) {
        return Mono.fromCallable(() -> {
            learningService.unblacklistSource(source);
            return learningService.sources();
        }).map(ResponseEntity::ok);
    }
}
