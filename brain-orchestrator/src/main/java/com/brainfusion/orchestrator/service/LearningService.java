package com.brainfusion.orchestrator.service;

import com.brainfusion.common.exception.RequestNotFoundException;
import com.brainfusion.common.learning.CrossBrainInsightGenerator;
import com.brainfusion.common.learning.ExternalKnowledgeIntegrator;
import com.brainfusion.common.learning.ExternalKnowledgeSubmission;
import com.brainfusion.common.learning.LearningHistory;
import com.brainfusion.common.learning.LearningMetrics;
import com.brainfusion.common.learning.LearningUpdateGenerator;
import com.brainfusion.common.model.DecisionRecord;
import com.brainfusion.common.model.ExecutionFeedback;
import com.brainfusion.common.model.LearningUpdate;
import com.brainfusion.common.model.ValidationResult;
import com.brainfusion.common.quality.QualityAssuranceValidator;
import com.brainfusion.common.quality.QualityMetrics;
import com.brainfusion.common.quality.ValidationSummary;
import com.brainfusion.common.reliability.BrainReliabilityTracker;
import com.brainfusion.common.trace.TraceContextUtil;
import com.brainfusion.orchestrator.config.BrainFusionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * The continuous-learning loop: feedback and external knowledge become candidate updates,
 * every candidate passes the quality gate, and the verdict decides its fate.
 *
 * <pre>
 *   invalid                  → discarded (kept in history)
 *   valid, manual review     → held in {@link ManualReviewQueue}
 *   valid                    → {@link LearningUpdateApplier}
 * </pre>
 */
@Service
public class LearningService {

    private static final Logger log = LoggerFactory.getLogger(LearningService.class);

    private final DecisionRegistry decisionRegistry;
    private final LearningUpdateGenerator updateGenerator;
    private final CrossBrainInsightGenerator insightGenerator;
    private final ExternalKnowledgeIntegrator externalIntegrator;
    private final QualityAssuranceValidator validator;
    private final LearningUpdateApplier applier;
    private final ManualReviewQueue reviewQueue;
    private final LearningHistory history;
    private final BrainReliabilityTracker reliabilityTracker;
    private final int recentUpdates;

    public LearningService(
            DecisionRegistry decisionRegistry,
            LearningUpdateGenerator updateGenerator,
            CrossBrainInsightGenerator insightGenerator,
            ExternalKnowledgeIntegrator externalIntegrator,
            QualityAssuranceValidator validator,
            LearningUpdateApplier applier,
            ManualReviewQueue reviewQueue,
            LearningHistory history,
            BrainReliabilityTracker reliabilityTracker,
            BrainFusionProperties properties) {
        this.decisionRegistry   = decisionRegistry;
        this.updateGenerator    = updateGenerator;
        this.insightGenerator   = insightGenerator;
        this.externalIntegrator = externalIntegrator;
        this.validator          = validator;
        this.applier            = applier;
        this.reviewQueue        = reviewQueue;
        this.history            = history;
        this.reliabilityTracker = reliabilityTracker;
        this.recentUpdates      = properties.getLearning().getRecentUpdates();
    }

    /**
     * Learns from the execution of decision {@code requestId}.
     * Errors with {@link RequestNotFoundException} when that decision is unknown.
     */
    public Mono<FeedbackResult> submitFeedback(String requestId, ExecutionFeedback feedback, String traceId) {
        return Mono.fromCallable(() -> {
            DecisionRecord record = decisionRegistry.find(requestId)
                .orElseThrow(() -> new RequestNotFoundException(requestId));
            ExecutionFeedback keyed = feedback.withRequestId(requestId);

            List<LearningUpdate> analytic = updateGenerator.analyze(record, keyed);
            List<LearningUpdate> candidates = new ArrayList<>(analytic);
            candidates.addAll(insightGenerator.generate(analytic));
            candidates.addAll(updateGenerator.reliabilityUpdates(record, keyed));

            FeedbackResult result = process(requestId, candidates);
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[Learning] Feedback processed. requestId={} outcome={} generated={} applied={} "
                         + "held={} rejected={} traceId={}",
                         requestId, keyed.outcome(), result.generated(), result.applied(),
                         result.heldForReview(), result.rejected(), traceId));
            return result;
        });
    }

    /**
     * Feeds an external knowledge payload through the gate. Errors with
     * {@link IllegalArgumentException} when the payload is malformed or unreliable.
     */
    public Mono<FeedbackResult> integrateExternalKnowledge(ExternalKnowledgeSubmission submission, String traceId) {
        return Mono.fromCallable(() -> {
            FeedbackResult result = process(null, externalIntegrator.integrate(submission));
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[Learning] External knowledge processed. source={} generated={} applied={} "
                         + "held={} rejected={} traceId={}",
                         submission.source(), result.generated(), result.applied(),
                         result.heldForReview(), result.rejected(), traceId));
            return result;
        });
    }

    FeedbackResult process(String requestId, List<LearningUpdate> candidates) {
        List<LearningUpdate> validated = new ArrayList<>(candidates.size());
        int applied = 0;
        int held = 0;
        int rejected = 0;
        for (LearningUpdate candidate : candidates) {
            ValidationResult verdict = validator.validate(candidate);
            LearningUpdate update = candidate.withValidation(verdict);
            history.record(update, verdict);
            validated.add(update);

            if (!verdict.valid()) {
                rejected++;
                log.debug("[Learning] Update discarded. id={} type={} quality={}",
                          update.id(), update.learningType(), verdict.qualityLevel());
            } else if (verdict.requiresManualReview()) {
                reviewQueue.hold(update, verdict);
                held++;
            } else {
                applier.apply(update, verdict);
                applied++;
            }
        }
        return new FeedbackResult(requestId, candidates.size(), applied, held, rejected, validated);
    }

    // ── manual review ────────────────────────────────────────────────────────

    public List<PendingReview> pendingReviews() {
        return reviewQueue.pending();
    }

    /**
     * Applies a held update.
     *
     * @throws NoSuchElementException if no update with that id is awaiting review
     */
    public LearningUpdateApplier.Target approve(String updateId) {
        PendingReview review = reviewQueue.take(updateId)
            .orElseThrow(() -> new NoSuchElementException("No pending review for update " + updateId));
        LearningUpdateApplier.Target target = applier.apply(review.update(), review.validation());
        log.info("[Review] Update approved. id={} appliedTo={}", updateId, target);
        return target;
    }

    /**
     * Drops a held update.
     *
     * @throws NoSuchElementException if no update with that id is awaiting review
     */
    public PendingReview dismiss(String updateId) {
        PendingReview review = reviewQueue.take(updateId)
            .orElseThrow(() -> new NoSuchElementException("No pending review for update " + updateId));
        log.info("[Review] Update dismissed. id={} type={}", updateId, review.update().learningType());
        return review;
    }

    // ── read side ────────────────────────────────────────────────────────────

    public LearningMetrics learningMetrics() {
        return history.metrics(recentUpdates);
    }

    /** The last {@code limit} updates recorded, newest last. */
    public List<LearningUpdate> recentUpdates(int limit) {
        List<LearningUpdate> all = history.updates();
        return all.subList(Math.max(0, all.size() - Math.max(0, limit)), all.size());
    }

    public QualityMetrics qualityMetrics() {
        return validator.metrics();
    }

    public List<ValidationSummary> recentValidations(int limit) {
        return validator.recentValidations(limit);
    }

    public Map<String, Double> reliability() {
        return reliabilityTracker.all();
    }

    // ── source management ────────────────────────────────────────────────────

    public void trustSource(String source) {
        validator.addTrustedSource(source);
    }

    public void blacklistSource(String source) {
        validator.addBlacklistedSource(source);
    }

    public void unblacklistSource(String source) {
        validator.removeBlacklistedSource(source);
    }

    public Map<String, List<String>> sources() {
        return Map.of(
            "trusted", validator.trustedSources().stream().sorted().toList(),
            "blacklisted", validator.blacklistedSources().stream().sorted().toList());
    }
}
