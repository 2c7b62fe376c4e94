package com.brainfusion.orchestrator.logger;

import com.brainfusion.common.model.AggregatedDecision;
import com.brainfusion.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each stage of a decision's journey through the orchestration pipeline.
 * Pure side effects; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #REQUEST_RECEIVED}    the decision request entered the pipeline</li>
 *   <li>{@link #INTENT_ANALYZED}     the Intent brain replied</li>
 *   <li>{@link #TECHNICAL_PLANNED}   the Technical brain produced a plan</li>
 *   <li>{@link #SME_CONSULTED}       every SME call completed or failed</li>
 *   <li>{@link #DECISION_ASSEMBLED}  confidence, risk and strategy were fused</li>
 *   <li>{@link #DECISION_REGISTERED} the decision was stored for feedback</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.INTENT_ANALYZED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String REQUEST_RECEIVED    = "REQUEST_RECEIVED";
    public static final String INTENT_ANALYZED     = "INTENT_ANALYZED";
    public static final String TECHNICAL_PLANNED   = "TECHNICAL_PLANNED";
    public static final String SME_CONSULTED       = "SME_CONSULTED";
    public static final String DECISION_ASSEMBLED  = "DECISION_ASSEMBLED";
    public static final String DECISION_REGISTERED = "DECISION_REGISTERED";

    /**
     * {@code doOnEach} consumer that logs {@code stageName} on {@code onNext} only.
     * The trace id is read from the Reactor Context and bridged into MDC for the log call.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    /** One-line summary of a finished decision. */
    public void logDecision(AggregatedDecision decision, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} requestId={} confidence={} risk={} strategy={} "
                     + "brains={} degraded={} elapsedMs={} traceId={}",
                     DECISION_REGISTERED,
                     decision.requestId(),
                     String.format("%.3f", decision.overallConfidence()),
                     decision.riskAssessment().overallRiskLevel(),
                     decision.executionStrategy(),
                     decision.contributingBrains().size(),
                     decision.isDegraded(),
                     decision.processingTimeMs(),
                     traceId)
        );
    }
}
