package com.brainfusion.orchestrator.service;

import com.brainfusion.common.aggregation.ConfidenceAggregator;
import com.brainfusion.common.aggregation.RiskAggregator;
import com.brainfusion.common.exception.DecisionTimeoutException;
import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.model.BrainAnalysis;
import com.brainfusion.common.model.BrainDescriptor;
import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.common.model.DecisionRequest;
import com.brainfusion.common.model.ExecutionStrategy;
import com.brainfusion.common.model.RiskAssessment;
import com.brainfusion.common.model.RiskLevel;
import com.brainfusion.common.model.SmeConsultation;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import com.brainfusion.common.strategy.ExecutionStrategySelector;
import com.brainfusion.common.strategy.RecommendationBuilder;
import com.brainfusion.common.trace.TraceContextUtil;
import com.brainfusion.orchestrator.config.BrainFusionProperties;
import com.brainfusion.orchestrator.guard.DegradedDecisionGuard;
import com.brainfusion.orchestrator.logger.DecisionFlowLogger;
import com.brainfusion.orchestrator.oracle.BrainRegistry;
import com.brainfusion.orchestrator.oracle.BrainRequest;
import com.brainfusion.orchestrator.oracle.ReasoningOracle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one decision: Intent, then Technical with the Intent output, then the SME fan-out,
 * then confidence and risk fusion, strategy selection and recommendations.
 *
 * <p>The returned {@code Mono} always emits a well-formed decision. An Intent or Technical
 * failure yields a degraded manual-review decision; an SME failure only removes that SME
 * from averaging; an expired request budget yields a manual-review decision built from
 * whatever brain results had arrived.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    /** Consulted in addition to the planned SMEs whenever Intent or Technical reports high risk. */
    public static final String SECURITY_DOMAIN = "security_and_compliance";

    private final BrainRegistry brainRegistry;
    private final BrainReliabilityTracker reliabilityTracker;
    private final DecisionRegistry decisionRegistry;
    private final DecisionFlowLogger decisionFlowLogger;
    private final Duration requestTimeout;
    private final boolean applyReliability;

    public OrchestratorService(
            BrainRegistry brainRegistry,
            BrainReliabilityTracker reliabilityTracker,
            DecisionRegistry decisionRegistry,
            DecisionFlowLogger decisionFlowLogger,
            BrainFusionProperties properties) {
        this.brainRegistry      = brainRegistry;
        this.reliabilityTracker = reliabilityTracker;
        this.decisionRegistry   = decisionRegistry;
        this.decisionFlowLogger = decisionFlowLogger;
        this.requestTimeout     = properties.getOrchestration().getRequestTimeout();
        this.applyReliability   = properties.getOrchestration().isApplyReliability();
    }

    public Mono<AggregatedDecision> decide(DecisionRequest request, String traceId) {
        if (request == null || request.text() == null || request.text().isBlank()) {
            return Mono.error(new IllegalArgumentException("Decision request text is required"));
        }
        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            final String requestId = request.resolvedRequestId();
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[Orchestrator] Decision started. requestId={} traceId={}", requestId, traceId));

            // Captured as each brain replies; read by the fallbacks and the registered record.
            final BrainAnalysis[]         intent        = {null};
            final BrainAnalysis[]         technical     = {null};
            final AtomicReference<List<SmeConsultation>> consultations = new AtomicReference<>(List.of());

            BrainRequest base = BrainRequest.of(request.text(), request.context());

            Mono<AggregatedDecision> pipeline = Mono.just(base)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REQUEST_RECEIVED))
                .flatMap(brainRequest -> brainRegistry.intent().analyze(brainRequest))
                .doOnNext(analysis -> intent[0] = analysis)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INTENT_ANALYZED))
                .flatMap(analysis -> brainRegistry.technical().analyze(base.withPriorOutput(analysis.content())))
                .doOnNext(analysis -> technical[0] = analysis)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.TECHNICAL_PLANNED))
                .flatMap(plan -> consultSmes(base, intent[0], plan, traceId))
                .doOnNext(consultations::set)
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.SME_CONSULTED))
                .map(list -> assemble(requestId, intent[0], technical[0], list, startTime))
                .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.DECISION_ASSEMBLED))
                .switchIfEmpty(Mono.defer(() ->
                    Mono.error(new IllegalStateException("A brain completed without a reply"))))
                .timeout(requestTimeout, Mono.defer(() ->
                    Mono.error(new DecisionTimeoutException("Decision " + requestId, requestTimeout))))
                .onErrorResume(DecisionTimeoutException.class, e -> {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("[Orchestrator] {}. intentReady={} technicalReady={} traceId={}",
                                 e.getMessage(), intent[0] != null, technical[0] != null, traceId));
                    consultations.set(List.of());
                    return Mono.just(DegradedDecisionGuard.timeoutDecision(requestId, intent[0], technical[0],
                        reliabilityFor(intent[0], technical[0], List.of()), requestTimeout, elapsed(startTime)));
                })
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.error("[Orchestrator] Decision failed, returning degraded decision. requestId={} "
                                  + "reason={} traceId={}", requestId, e.getMessage(), traceId, e));
                    List<String> contributing = new ArrayList<>();
                    if (intent[0] != null) contributing.add(intent[0].brainId());
                    if (technical[0] != null) contributing.add(technical[0].brainId());
                    return Mono.just(DegradedDecisionGuard.errorDecision(requestId, e.getMessage(),
                        contributing, elapsed(startTime)));
                })
                .doOnNext(decision -> {
                    decisionRegistry.register(new DecisionRecord(decision, intent[0], technical[0],
                        consultations.get(), traceId));
                    decisionFlowLogger.logDecision(decision, traceId);
                });

            return TraceContextUtil.withTraceId(pipeline, traceId);
        });
    }

    // ── SME fan-out ──────────────────────────────────────────────────────────

    /**
     * Consults every registered SME named in the plan, plus the security SME on high risk,
     * concurrently. Results keep the order of the requested domains; a failed call becomes
     * {@link SmeConsultation.Failed}. Domains with no registered SME are skipped.
     */
    Mono<List<SmeConsultation>> consultSmes(BrainRequest base, BrainAnalysis intent, BrainAnalysis technical,
                                            String traceId) {
        Set<String> domains = new LinkedHashSet<>(technical.smeNeeds());
        if (intent.riskLevel() == RiskLevel.HIGH || technical.riskLevel() == RiskLevel.HIGH) {
            domains.add(SECURITY_DOMAIN);
        }

        List<ReasoningOracle> smes = new ArrayList<>();
        for (String domain : domains) {
            brainRegistry.sme(domain).ifPresentOrElse(smes::add, () ->
                TraceContextUtil.withMdc(traceId, () ->
                    log.warn("[Orchestrator] No SME registered for domain, skipping. domain={} traceId={}",
                             domain, traceId)));
        }
        if (smes.isEmpty()) {
            return Mono.just(List.of());
        }

        BrainRequest smeRequest = base.withPriorOutput(technical.content());
        return Flux.fromIterable(smes)
            .flatMapSequential(sme -> sme.consult(smeRequest)
                .onErrorResume(e -> {
                    TraceContextUtil.withMdc(traceId, () ->
                        log.warn("[Orchestrator] SME consultation failed. domain={} reason={} traceId={}",
                                 sme.descriptor().domain(), e.getMessage(), traceId));
                    return Mono.just(new SmeConsultation.Failed(sme.descriptor().domain(),
                        e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
                }))
            .collectList();
    }

    // ── assembly ─────────────────────────────────────────────────────────────

    AggregatedDecision assemble(String requestId, BrainAnalysis intent, BrainAnalysis technical,
                                List<SmeConsultation> consultations, long startTime) {
        double confidence = ConfidenceAggregator.aggregate(intent, technical, consultations,
            reliabilityFor(intent, technical, consultations));
        RiskAssessment risk = RiskAggregator.aggregate(intent, technical, consultations);
        ExecutionStrategy strategy = ExecutionStrategySelector.select(confidence, risk.overallRiskLevel(),
            intent.actionType());
        List<String> recommendations = RecommendationBuilder.build(strategy, technical, consultations);

        List<String> contributing = new ArrayList<>();
        contributing.add(intent.brainId());
        contributing.add(technical.brainId());
        List<String> consulted = new ArrayList<>();
        List<String> failed    = new ArrayList<>();
        for (SmeConsultation consultation : consultations) {
            if (consultation.isError()) {
                failed.add(consultation.domain());
            } else {
                consulted.add(consultation.domain());
                contributing.add(smeBrainId(consultation));
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(AggregatedDecision.META_SME_CONSULTED, consulted);
        metadata.put(AggregatedDecision.META_SME_FAILED, failed);
        return new AggregatedDecision(requestId, confidence, strategy, risk, recommendations, contributing,
            elapsed(startTime), metadata, Instant.now());
    }

    private Map<String, Double> reliabilityFor(BrainAnalysis intent, BrainAnalysis technical,
                                               List<SmeConsultation> consultations) {
        if (!applyReliability) {
            return Map.of();
        }
        List<String> brains = new ArrayList<>();
        if (intent != null) brains.add(intent.brainId());
        if (technical != null) brains.add(technical.brainId());
        for (SmeConsultation consultation : consultations) {
            if (!consultation.isError()) {
                brains.add(smeBrainId(consultation));
            }
        }
        return reliabilityTracker.reliabilityFor(brains);
    }

    private static String smeBrainId(SmeConsultation consultation) {
        if (consultation instanceof SmeConsultation.Structured structured) {
            return structured.analysis().brainId();
        }
        return BrainDescriptor.smeBrainId(consultation.domain());
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }
}
